package io.github.eutro.exnorm.transform;

import io.github.eutro.exnorm.ast.Node;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * The bottom-up rewriting primitive every pass is built on.
 * <p>
 * One call is exactly one post-order sweep: each node is visited once, after all of its
 * children have been rewritten, and whatever the visit returns is not visited again.
 * Subtrees in which nothing changed keep their identity.
 * <p>
 * Patterns are not visited; nodes inside patterns are literals only.
 */
public final class Transformer {
    private final ContextVisit visit;
    private final Deque<Node> ancestors = new ArrayDeque<>();
    private final VisitContext context = new VisitContext(ancestors);

    private Transformer(ContextVisit visit) {
        this.visit = visit;
    }

    public static Node transform(Node root, TreeVisit visit) {
        return transform(root, (node, ctx) -> visit.visit(node));
    }

    public static Node transform(Node root, ContextVisit visit) {
        return new Transformer(visit).walk(root);
    }

    private Node walk(Node original) {
        ancestors.push(original);
        Node rewritten;
        try {
            rewritten = original.map(this::walk);
        } finally {
            ancestors.pop();
        }
        context.setOriginal(original);
        return visit.visit(rewritten, context);
    }
}
