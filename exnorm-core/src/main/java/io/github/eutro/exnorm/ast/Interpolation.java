package io.github.eutro.exnorm.ast;

import io.github.eutro.exnorm.ext.Meta;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * An interpolated string. {@link Str} parts are literal text, other parts are interpolated expressions.
 */
public final class Interpolation extends Node {
    @NotNull
    public final List<Node> parts;

    public Interpolation(List<Node> parts, Meta meta) {
        super(meta);
        this.parts = Nodes.list(parts, "parts");
    }

    public Interpolation(List<Node> parts) {
        this(parts, Meta.EMPTY);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitInterpolation(this);
    }

    @Override
    public Node map(UnaryOperator<Node> f) {
        List<Node> parts = Nodes.mapAll(this.parts, f);
        if (parts == this.parts) return this;
        return new Interpolation(parts, meta);
    }

    @Override
    public void forEachChild(Consumer<Node> consumer) {
        parts.forEach(consumer);
    }

    @Override
    public Interpolation withMeta(Meta meta) {
        return meta == this.meta ? this : new Interpolation(parts, meta);
    }

    @Override
    protected List<?> components() {
        return Collections.singletonList(parts);
    }
}
