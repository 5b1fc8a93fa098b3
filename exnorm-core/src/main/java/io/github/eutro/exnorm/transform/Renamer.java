package io.github.eutro.exnorm.transform;

import io.github.eutro.exnorm.analysis.UsageAnalyzer;
import io.github.eutro.exnorm.ast.*;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Consistent renaming of a variable: reads, binders and pins alike.
 * <p>
 * The caller must make sure the new name is not already mentioned in the subtree. Renaming
 * is refused when the old name occurs in opaque text, since the text cannot be rewritten.
 */
public final class Renamer {
    private Renamer() {
    }

    /**
     * Rename a variable throughout a subtree.
     *
     * @param node The subtree.
     * @param from The old name.
     * @param to   The new name.
     * @return The renamed subtree, or null if the old name occurs in an opaque fragment.
     */
    @Nullable
    public static Node rename(Node node, String from, String to) {
        if (UsageAnalyzer.occursInOpaque(node, from)) return null;
        return Transformer.transform(node, n -> {
            if (n instanceof Var && ((Var) n).name.equals(from)) {
                return new Var(to, n.meta);
            }
            return n.mapPatterns(p -> Patterns.rename(p, from, to));
        });
    }

    /**
     * Rename a variable throughout a list of statements.
     *
     * @param statements The statements.
     * @param from       The old name.
     * @param to         The new name.
     * @return The renamed statements, or null if the old name occurs in an opaque fragment.
     */
    @Nullable
    public static List<Node> rename(List<Node> statements, String from, String to) {
        for (Node statement : statements) {
            if (UsageAnalyzer.occursInOpaque(statement, from)) return null;
        }
        return Nodes.mapAll(statements, statement -> rename(statement, from, to));
    }
}
