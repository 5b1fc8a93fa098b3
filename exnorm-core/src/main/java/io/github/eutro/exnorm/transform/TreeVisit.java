package io.github.eutro.exnorm.transform;

import io.github.eutro.exnorm.ast.Node;

/**
 * The per-node step of a bottom-up sweep.
 *
 * @see Transformer#transform(Node, TreeVisit)
 */
@FunctionalInterface
public interface TreeVisit {
    /**
     * Rewrite a node whose children have already been rewritten.
     *
     * @param node The node.
     * @return The node itself, or its replacement.
     */
    Node visit(Node node);
}
