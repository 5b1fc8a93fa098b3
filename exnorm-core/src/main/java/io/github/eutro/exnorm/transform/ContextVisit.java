package io.github.eutro.exnorm.transform;

import io.github.eutro.exnorm.ast.Node;

/**
 * A {@link TreeVisit} that also sees where the node sits in the original tree.
 *
 * @see Transformer#transform(Node, ContextVisit)
 */
@FunctionalInterface
public interface ContextVisit {
    /**
     * Rewrite a node whose children have already been rewritten.
     *
     * @param node    The node, with rewritten children.
     * @param context The position of the node in the original tree. Only valid during this call.
     * @return The node itself, or its replacement.
     */
    Node visit(Node node, VisitContext context);
}
