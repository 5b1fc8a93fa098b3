package io.github.eutro.exnorm.ast;

import io.github.eutro.exnorm.ext.Meta;

import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A float literal.
 */
public final class FloatLit extends Node {
    public final double value;

    public FloatLit(double value, Meta meta) {
        super(meta);
        this.value = value;
    }

    public FloatLit(double value) {
        this(value, Meta.EMPTY);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitFloatLit(this);
    }

    @Override
    public Node map(UnaryOperator<Node> f) {
        return this;
    }

    @Override
    public void forEachChild(Consumer<Node> consumer) {
    }

    @Override
    public FloatLit withMeta(Meta meta) {
        return meta == this.meta ? this : new FloatLit(value, meta);
    }

    @Override
    protected List<?> components() {
        return Collections.singletonList(value);
    }
}
