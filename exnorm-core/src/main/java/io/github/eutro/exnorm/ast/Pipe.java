package io.github.eutro.exnorm.ast;

import io.github.eutro.exnorm.ext.Meta;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A pipe, {@code left |> right}.
 */
public final class Pipe extends Node {
    @NotNull
    public final Node left;
    @NotNull
    public final Node right;

    public Pipe(Node left, Node right, Meta meta) {
        super(meta);
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
    }

    public Pipe(Node left, Node right) {
        this(left, right, Meta.EMPTY);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitPipe(this);
    }

    @Override
    public Node map(UnaryOperator<Node> f) {
        Node left = f.apply(this.left);
        Node right = f.apply(this.right);
        if (left == this.left && right == this.right) return this;
        return new Pipe(left, right, meta);
    }

    @Override
    public void forEachChild(Consumer<Node> consumer) {
        consumer.accept(left);
        consumer.accept(right);
    }

    @Override
    public Pipe withMeta(Meta meta) {
        return meta == this.meta ? this : new Pipe(left, right, meta);
    }

    @Override
    protected List<?> components() {
        return Arrays.asList(left, right);
    }
}
