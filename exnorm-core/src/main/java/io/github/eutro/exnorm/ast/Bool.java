package io.github.eutro.exnorm.ast;

import io.github.eutro.exnorm.ext.Meta;

import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A {@code true} or {@code false} literal.
 */
public final class Bool extends Node {
    public final boolean value;

    public Bool(boolean value, Meta meta) {
        super(meta);
        this.value = value;
    }

    public Bool(boolean value) {
        this(value, Meta.EMPTY);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitBool(this);
    }

    @Override
    public Node map(UnaryOperator<Node> f) {
        return this;
    }

    @Override
    public void forEachChild(Consumer<Node> consumer) {
    }

    @Override
    public Bool withMeta(Meta meta) {
        return meta == this.meta ? this : new Bool(value, meta);
    }

    @Override
    protected List<?> components() {
        return Collections.singletonList(value);
    }
}
