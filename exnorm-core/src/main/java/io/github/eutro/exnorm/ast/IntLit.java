package io.github.eutro.exnorm.ast;

import io.github.eutro.exnorm.ext.Meta;

import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * An integer literal.
 */
public final class IntLit extends Node {
    public final long value;

    public IntLit(long value, Meta meta) {
        super(meta);
        this.value = value;
    }

    public IntLit(long value) {
        this(value, Meta.EMPTY);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitIntLit(this);
    }

    @Override
    public Node map(UnaryOperator<Node> f) {
        return this;
    }

    @Override
    public void forEachChild(Consumer<Node> consumer) {
    }

    @Override
    public IntLit withMeta(Meta meta) {
        return meta == this.meta ? this : new IntLit(value, meta);
    }

    @Override
    protected List<?> components() {
        return Collections.singletonList(value);
    }
}
