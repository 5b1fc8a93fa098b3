package io.github.eutro.exnorm.ast;

import io.github.eutro.exnorm.ext.Meta;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A string literal, without interpolation.
 */
public final class Str extends Node {
    @NotNull
    public final String value;

    public Str(String value, Meta meta) {
        super(meta);
        this.value = Objects.requireNonNull(value, "value");
    }

    public Str(String value) {
        this(value, Meta.EMPTY);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitStr(this);
    }

    @Override
    public Node map(UnaryOperator<Node> f) {
        return this;
    }

    @Override
    public void forEachChild(Consumer<Node> consumer) {
    }

    @Override
    public Str withMeta(Meta meta) {
        return meta == this.meta ? this : new Str(value, meta);
    }

    @Override
    protected List<?> components() {
        return Collections.singletonList(value);
    }
}
