package io.github.eutro.exnorm.ast;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Queries and rewrites over patterns.
 */
public final class Patterns {
    private Patterns() {
    }

    /**
     * Call a consumer for a pattern and all of its sub-patterns, parents first.
     *
     * @param pattern  The pattern.
     * @param consumer The consumer.
     */
    public static void walk(Pattern pattern, Consumer<Pattern> consumer) {
        consumer.accept(pattern);
        pattern.forEachChild(child -> walk(child, consumer));
    }

    /**
     * Rewrite a pattern bottom-up.
     *
     * @param pattern The pattern.
     * @param f       The function, applied to every sub-pattern after its children.
     * @return The rewritten pattern, or the same instance if nothing changed.
     */
    public static Pattern rewrite(Pattern pattern, UnaryOperator<Pattern> f) {
        return f.apply(pattern.map(child -> rewrite(child, f)));
    }

    /**
     * Every name bound by the pattern, in order of first occurrence. Pinned names are not bound.
     *
     * @param pattern The pattern.
     * @return The names.
     */
    public static Set<String> boundNames(Pattern pattern) {
        return new LinkedHashSet<>(binderOccurrences(pattern));
    }

    /**
     * Every binder occurrence in the pattern, repeats included.
     *
     * @param pattern The pattern.
     * @return The names.
     */
    public static List<String> binderOccurrences(Pattern pattern) {
        List<String> names = new ArrayList<>();
        walk(pattern, p -> {
            if (p instanceof PVar) {
                names.add(((PVar) p).name);
            } else if (p instanceof PAlias) {
                names.add(((PAlias) p).name);
            }
        });
        return names;
    }

    public static Set<String> pinnedNames(Pattern pattern) {
        Set<String> names = new LinkedHashSet<>();
        walk(pattern, p -> {
            if (p instanceof PPin) names.add(((PPin) p).name);
        });
        return names;
    }

    /**
     * Whether the pattern binds the given name.
     *
     * @param pattern The pattern.
     * @param name    The name.
     * @return Whether it is bound.
     */
    public static boolean binds(Pattern pattern, String name) {
        return binderOccurrences(pattern).contains(name);
    }

    /**
     * Rename a name everywhere in a pattern, binders and pins alike.
     *
     * @param pattern The pattern.
     * @param from    The old name.
     * @param to      The new name.
     * @return The renamed pattern.
     */
    public static Pattern rename(Pattern pattern, String from, String to) {
        return rewrite(pattern, p -> {
            if (p instanceof PPin && ((PPin) p).name.equals(from)) return new PPin(to);
            return renameBinderShallow(p, from, to);
        });
    }

    /**
     * Rename only the binders of a name in a pattern, leaving pins alone.
     *
     * @param pattern The pattern.
     * @param from    The old name.
     * @param to      The new name.
     * @return The renamed pattern.
     */
    public static Pattern renameBinder(Pattern pattern, String from, String to) {
        return rewrite(pattern, p -> renameBinderShallow(p, from, to));
    }

    private static Pattern renameBinderShallow(Pattern p, String from, String to) {
        if (p instanceof PVar && ((PVar) p).name.equals(from)) return new PVar(to);
        if (p instanceof PAlias && ((PAlias) p).name.equals(from)) return new PAlias(to, ((PAlias) p).pattern);
        return p;
    }

    /**
     * Whether the pattern matches every value.
     *
     * @param pattern The pattern.
     * @return Whether it cannot fail.
     */
    public static boolean isIrrefutable(Pattern pattern) {
        if (pattern instanceof PVar || pattern instanceof PWildcard) return true;
        if (pattern instanceof PAlias) return isIrrefutable(((PAlias) pattern).pattern);
        return false;
    }

    /**
     * Whether the pattern is a single binder, so a match with it is a plain assignment.
     *
     * @param pattern The pattern.
     * @return Whether it is a {@link PVar}.
     */
    public static boolean isSimpleBinder(Pattern pattern) {
        return pattern instanceof PVar;
    }
}
