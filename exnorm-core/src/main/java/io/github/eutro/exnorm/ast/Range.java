package io.github.eutro.exnorm.ast;

import io.github.eutro.exnorm.ext.Meta;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A range, {@code first..last//step}.
 */
public final class Range extends Node {
    @NotNull
    public final Node first;
    @NotNull
    public final Node last;
    @Nullable
    public final Node step;

    public Range(Node first, Node last, @Nullable Node step, Meta meta) {
        super(meta);
        this.first = Objects.requireNonNull(first, "first");
        this.last = Objects.requireNonNull(last, "last");
        this.step = step;
    }

    public Range(Node first, Node last, @Nullable Node step) {
        this(first, last, step, Meta.EMPTY);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitRange(this);
    }

    @Override
    public Node map(UnaryOperator<Node> f) {
        Node first = f.apply(this.first);
        Node last = f.apply(this.last);
        Node step = Nodes.mapNullable(this.step, f);
        if (first == this.first && last == this.last && step == this.step) return this;
        return new Range(first, last, step, meta);
    }

    @Override
    public void forEachChild(Consumer<Node> consumer) {
        consumer.accept(first);
        consumer.accept(last);
        Nodes.forNullable(step, consumer);
    }

    @Override
    public Range withMeta(Meta meta) {
        return meta == this.meta ? this : new Range(first, last, step, meta);
    }

    @Override
    protected List<?> components() {
        return Arrays.asList(first, last, step);
    }
}
