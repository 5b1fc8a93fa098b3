package io.github.eutro.exnorm.transform;

import io.github.eutro.exnorm.ast.Node;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * The position of a node being visited, in terms of the tree before the sweep.
 * <p>
 * The nodes returned here are the originals, so their children can be compared
 * by identity with {@link #original()}.
 */
public final class VisitContext {
    private final Deque<Node> ancestors;
    private Node original;

    VisitContext(Deque<Node> ancestors) {
        this.ancestors = ancestors;
    }

    void setOriginal(Node original) {
        this.original = original;
    }

    /**
     * The node as it was before its children were rewritten.
     *
     * @return The original node.
     */
    public Node original() {
        return original;
    }

    /**
     * The original parent of the node, or null at the root.
     *
     * @return The parent.
     */
    @Nullable
    public Node parent() {
        return ancestors.peek();
    }

    /**
     * The original ancestors of the node, nearest first.
     *
     * @return A snapshot of the ancestors.
     */
    public List<Node> ancestors() {
        return new ArrayList<>(ancestors);
    }

    public boolean isRoot() {
        return ancestors.isEmpty();
    }

    /**
     * Find the nearest ancestor of a given shape.
     *
     * @param type The shape.
     * @param <T>  The shape.
     * @return The ancestor, or null if there is none.
     */
    @Nullable
    public <T extends Node> T nearest(Class<T> type) {
        for (Node ancestor : ancestors) {
            if (type.isInstance(ancestor)) return type.cast(ancestor);
        }
        return null;
    }
}
