package io.github.eutro.exnorm.analysis;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * The one routine used to look for names in opaque text ({@link io.github.eutro.exnorm.ast.Raw}
 * and {@link io.github.eutro.exnorm.ast.Template} fragments).
 * <p>
 * A run of letters, digits and underscores is an identifier. A name occurs in text only where
 * neither neighbouring character could extend it. This over-approximates uses, which is safe:
 * a false positive only prevents a rewrite.
 */
public final class TokenScan {
    private static final Pattern ATTRIBUTE_ACCESS = Pattern.compile("@[a-z_]");

    private TokenScan() {
    }

    public static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    /**
     * Whether the name occurs in the text as a whole token.
     *
     * @param text The text.
     * @param name The name.
     * @return Whether it occurs.
     */
    public static boolean containsIdentifier(String text, String name) {
        if (name.isEmpty()) return false;
        int from = 0;
        int i;
        while ((i = text.indexOf(name, from)) >= 0) {
            int end = i + name.length();
            if ((i == 0 || !isIdentifierChar(text.charAt(i - 1)))
                    && (end == text.length() || !isIdentifierChar(text.charAt(end)))) {
                return true;
            }
            from = i + 1;
        }
        return false;
    }

    /**
     * Every maximal identifier run in the text.
     *
     * @param text The text.
     * @return The identifiers, in order of first occurrence.
     */
    public static Set<String> identifiers(String text) {
        Set<String> found = new LinkedHashSet<>();
        int start = -1;
        for (int i = 0; i <= text.length(); i++) {
            boolean ident = i < text.length() && isIdentifierChar(text.charAt(i));
            if (ident && start < 0) {
                start = i;
            } else if (!ident && start >= 0) {
                found.add(text.substring(start, i));
                start = -1;
            }
        }
        return found;
    }

    /**
     * Whether a template accesses an assign with {@code @name}, which reads {@code assigns}.
     *
     * @param text The template text.
     * @return Whether there is such an access.
     */
    public static boolean hasAttributeAccess(String text) {
        return ATTRIBUTE_ACCESS.matcher(text).find();
    }
}
