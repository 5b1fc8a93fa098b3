package io.github.eutro.exnorm.ast;

import io.github.eutro.exnorm.ext.Meta;

import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * The {@code nil} literal.
 */
public final class Nil extends Node {
    public Nil(Meta meta) {
        super(meta);
    }

    public Nil() {
        this(Meta.EMPTY);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitNil(this);
    }

    @Override
    public Node map(UnaryOperator<Node> f) {
        return this;
    }

    @Override
    public void forEachChild(Consumer<Node> consumer) {
    }

    @Override
    public Nil withMeta(Meta meta) {
        return meta == this.meta ? this : new Nil(meta);
    }

    @Override
    protected List<?> components() {
        return Collections.emptyList();
    }
}
