package io.github.eutro.exnorm.ast;

import io.github.eutro.exnorm.ext.Meta;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A {@code throw} of a value.
 */
public final class Throw extends Node {
    @NotNull
    public final Node value;

    public Throw(Node value, Meta meta) {
        super(meta);
        this.value = Objects.requireNonNull(value, "value");
    }

    public Throw(Node value) {
        this(value, Meta.EMPTY);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitThrow(this);
    }

    @Override
    public Node map(UnaryOperator<Node> f) {
        Node value = f.apply(this.value);
        if (value == this.value) return this;
        return new Throw(value, meta);
    }

    @Override
    public void forEachChild(Consumer<Node> consumer) {
        consumer.accept(value);
    }

    @Override
    public Throw withMeta(Meta meta) {
        return meta == this.meta ? this : new Throw(value, meta);
    }

    @Override
    protected List<?> components() {
        return Collections.singletonList(value);
    }
}
