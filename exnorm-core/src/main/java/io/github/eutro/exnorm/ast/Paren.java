package io.github.eutro.exnorm.ast;

import io.github.eutro.exnorm.ext.Meta;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A parenthesised expression.
 */
public final class Paren extends Node {
    @NotNull
    public final Node inner;

    public Paren(Node inner, Meta meta) {
        super(meta);
        this.inner = Objects.requireNonNull(inner, "inner");
    }

    public Paren(Node inner) {
        this(inner, Meta.EMPTY);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitParen(this);
    }

    @Override
    public Node map(UnaryOperator<Node> f) {
        Node inner = f.apply(this.inner);
        if (inner == this.inner) return this;
        return new Paren(inner, meta);
    }

    @Override
    public void forEachChild(Consumer<Node> consumer) {
        consumer.accept(inner);
    }

    @Override
    public Paren withMeta(Meta meta) {
        return meta == this.meta ? this : new Paren(inner, meta);
    }

    @Override
    protected List<?> components() {
        return Collections.singletonList(inner);
    }
}
