package io.github.eutro.exnorm.analysis;

import io.github.eutro.exnorm.ast.*;

import java.util.List;

/**
 * Answers whether a name is read, by walking the tree directly.
 * <p>
 * A read is a {@link Var}, a {@link PPin}, an occurrence in the size spec of a bitstring segment,
 * or an occurrence of the name as a token in a {@link Raw} or {@link Template} fragment.
 * A {@link Template} that accesses {@code @field} also reads {@code assigns}.
 * Binders ({@link PVar}, {@link PAlias}) are never reads.
 * <p>
 * Every subtree is searched: right-hand sides, guards, branches, clause bodies, comprehension
 * generators and bodies, function literals and interpolations alike. Shadowing is ignored, which
 * can only report more reads than there are.
 *
 * @see UsageIndex
 */
public final class UsageAnalyzer {
    private UsageAnalyzer() {
    }

    /**
     * Whether the name is read in any statement at or after {@code fromIndex}.
     *
     * @param statements The statements.
     * @param fromIndex  The first statement to search.
     * @param name       The name.
     * @return Whether there is a read.
     */
    public static boolean isReferenced(List<Node> statements, int fromIndex, String name) {
        if (fromIndex < 0) throw new IndexOutOfBoundsException("fromIndex " + fromIndex);
        for (int i = fromIndex; i < statements.size(); i++) {
            if (isReferencedIn(statements.get(i), name)) return true;
        }
        return false;
    }

    /**
     * Whether the name is read in statements {@code [fromIndex, toIndex)}.
     *
     * @param statements The statements.
     * @param fromIndex  The first statement to search.
     * @param toIndex    The end of the range, exclusive.
     * @param name       The name.
     * @return Whether there is a read.
     */
    public static boolean isReferencedBetween(List<Node> statements, int fromIndex, int toIndex, String name) {
        for (int i = fromIndex; i < toIndex && i < statements.size(); i++) {
            if (isReferencedIn(statements.get(i), name)) return true;
        }
        return false;
    }

    public static boolean isReferencedIn(Node node, String name) {
        ReadCounter counter = new ReadCounter(name, 1);
        counter.node(node);
        return counter.count > 0;
    }

    /**
     * Count the reads of a name in a subtree. An opaque fragment counts once however often
     * the name appears in it.
     *
     * @param node The subtree.
     * @param name The name.
     * @return The number of reads.
     */
    public static int countReads(Node node, String name) {
        ReadCounter counter = new ReadCounter(name, Integer.MAX_VALUE);
        counter.node(node);
        return counter.count;
    }

    public static boolean isReadInPattern(Pattern pattern, String name) {
        ReadCounter counter = new ReadCounter(name, 1);
        counter.pattern(pattern);
        return counter.count > 0;
    }

    /**
     * Whether the name occurs in any opaque fragment of the subtree.
     *
     * @param node The subtree.
     * @param name The name.
     * @return Whether it occurs.
     */
    public static boolean occursInOpaque(Node node, String name) {
        if (node instanceof Raw) return TokenScan.containsIdentifier(((Raw) node).code, name);
        if (node instanceof Template) return templateReads((Template) node, name);
        boolean[] found = {false};
        node.forEachPattern(p -> Patterns.walk(p, sub -> {
            if (sub instanceof PBinary) {
                for (Segment segment : ((PBinary) sub).segments) {
                    if (segment.spec != null && TokenScan.containsIdentifier(segment.spec, name)) found[0] = true;
                }
            }
        }));
        if (found[0]) return true;
        node.forEachChild(child -> {
            if (!found[0] && occursInOpaque(child, name)) found[0] = true;
        });
        return found[0];
    }

    static boolean templateReads(Template template, String name) {
        return TokenScan.containsIdentifier(template.text, name)
                || "assigns".equals(name) && TokenScan.hasAttributeAccess(template.text);
    }

    private static final class ReadCounter {
        private final String name;
        private final int limit;
        int count;

        ReadCounter(String name, int limit) {
            this.name = name;
            this.limit = limit;
        }

        void node(Node node) {
            if (count >= limit) return;
            if (node instanceof Var) {
                if (((Var) node).name.equals(name)) count++;
                return;
            }
            if (node instanceof Raw) {
                if (TokenScan.containsIdentifier(((Raw) node).code, name)) count++;
                return;
            }
            if (node instanceof Template) {
                if (templateReads((Template) node, name)) count++;
                return;
            }
            node.forEachPattern(this::pattern);
            node.forEachChild(this::node);
        }

        void pattern(Pattern pattern) {
            Patterns.walk(pattern, sub -> {
                if (sub instanceof PPin) {
                    if (((PPin) sub).name.equals(name)) count++;
                } else if (sub instanceof PBinary) {
                    for (Segment segment : ((PBinary) sub).segments) {
                        if (segment.spec != null && TokenScan.containsIdentifier(segment.spec, name)) count++;
                    }
                }
            });
        }
    }
}
