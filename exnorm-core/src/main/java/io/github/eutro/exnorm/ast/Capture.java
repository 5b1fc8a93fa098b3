package io.github.eutro.exnorm.ast;

import io.github.eutro.exnorm.ext.Meta;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A function capture: {@code &target/arity}, or {@code &(target)} if the arity is negative.
 */
public final class Capture extends Node {
    @NotNull
    public final Node target;
    public final int arity;

    public Capture(Node target, int arity, Meta meta) {
        super(meta);
        this.target = Objects.requireNonNull(target, "target");
        this.arity = arity;
    }

    public Capture(Node target, int arity) {
        this(target, arity, Meta.EMPTY);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitCapture(this);
    }

    @Override
    public Node map(UnaryOperator<Node> f) {
        Node target = f.apply(this.target);
        if (target == this.target) return this;
        return new Capture(target, arity, meta);
    }

    @Override
    public void forEachChild(Consumer<Node> consumer) {
        consumer.accept(target);
    }

    @Override
    public Capture withMeta(Meta meta) {
        return meta == this.meta ? this : new Capture(target, arity, meta);
    }

    @Override
    protected List<?> components() {
        return Arrays.asList(target, arity);
    }
}
