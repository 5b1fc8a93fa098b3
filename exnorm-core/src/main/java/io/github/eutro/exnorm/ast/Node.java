package io.github.eutro.exnorm.ast;

import io.github.eutro.exnorm.ast.display.TreeDisplay;
import io.github.eutro.exnorm.ext.Ext;
import io.github.eutro.exnorm.ext.ExtContainer;
import io.github.eutro.exnorm.ext.Meta;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A node of the intermediate tree.
 * <p>
 * The set of node shapes is closed: the constructor is package-private, and every
 * shape is a final class in this package, listed in {@link NodeVisitor}.
 * <p>
 * Nodes are immutable. Equality is structural, and ignores metadata.
 */
public abstract class Node implements ExtContainer {
    /**
     * The metadata of this node.
     */
    @NotNull
    public final Meta meta;

    Node(Meta meta) {
        this.meta = Objects.requireNonNull(meta, "meta");
    }

    /**
     * Dispatch to the method of the visitor for this shape.
     *
     * @param visitor The visitor.
     * @param <R>     The result type.
     * @return The result of the visitor.
     */
    public abstract <R> R accept(NodeVisitor<R> visitor);

    /**
     * Apply a function to every direct child node, including nodes held in clauses.
     * <p>
     * If the function returns every child unchanged (by identity), this node is returned.
     *
     * @param f The function.
     * @return The node with mapped children.
     */
    public abstract Node map(UnaryOperator<Node> f);

    /**
     * Call a consumer for every direct child node, in evaluation order.
     *
     * @param consumer The consumer.
     */
    public abstract void forEachChild(Consumer<Node> consumer);

    /**
     * Call a consumer for every pattern held directly by this node (not by its children).
     *
     * @param consumer The consumer.
     */
    public void forEachPattern(Consumer<Pattern> consumer) {
    }

    /**
     * Apply a function to every pattern held directly by this node.
     *
     * @param f The function.
     * @return The node with mapped patterns, or this if none changed.
     */
    public Node mapPatterns(UnaryOperator<Pattern> f) {
        return this;
    }

    /**
     * Return a copy of this node with the given metadata.
     *
     * @param meta The metadata.
     * @return The copy.
     */
    public abstract Node withMeta(Meta meta);

    /**
     * The fields that make up the structure of this node, for equality.
     *
     * @return The fields.
     */
    protected abstract List<?> components();

    @Nullable
    public SourcePos pos() {
        return meta.pos;
    }

    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        return meta.getNullable(ext);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || o.getClass() != getClass()) return false;
        return components().equals(((Node) o).components());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode() * 31 + components().hashCode();
    }

    @Override
    public String toString() {
        return TreeDisplay.display(this);
    }
}
