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
 * A module attribute. With a value it defines the attribute ({@code @name value}), without one it reads it.
 */
public final class Attribute extends Node {
    @NotNull
    public final String name;
    @Nullable
    public final Node value;

    public Attribute(String name, @Nullable Node value, Meta meta) {
        super(meta);
        this.name = Objects.requireNonNull(name, "name");
        this.value = value;
    }

    public Attribute(String name, @Nullable Node value) {
        this(name, value, Meta.EMPTY);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitAttribute(this);
    }

    @Override
    public Node map(UnaryOperator<Node> f) {
        Node value = Nodes.mapNullable(this.value, f);
        if (value == this.value) return this;
        return new Attribute(name, value, meta);
    }

    @Override
    public void forEachChild(Consumer<Node> consumer) {
        Nodes.forNullable(value, consumer);
    }

    @Override
    public Attribute withMeta(Meta meta) {
        return meta == this.meta ? this : new Attribute(name, value, meta);
    }

    @Override
    protected List<?> components() {
        return Arrays.asList(name, value);
    }
}
