package io.github.eutro.exnorm.ast;

import io.github.eutro.exnorm.ext.Meta;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A {@code raise} of an exception.
 */
public final class Raise extends Node {
    @NotNull
    public final Node error;

    public Raise(Node error, Meta meta) {
        super(meta);
        this.error = Objects.requireNonNull(error, "error");
    }

    public Raise(Node error) {
        this(error, Meta.EMPTY);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitRaise(this);
    }

    @Override
    public Node map(UnaryOperator<Node> f) {
        Node error = f.apply(this.error);
        if (error == this.error) return this;
        return new Raise(error, meta);
    }

    @Override
    public void forEachChild(Consumer<Node> consumer) {
        consumer.accept(error);
    }

    @Override
    public Raise withMeta(Meta meta) {
        return meta == this.meta ? this : new Raise(error, meta);
    }

    @Override
    protected List<?> components() {
        return Collections.singletonList(error);
    }
}
