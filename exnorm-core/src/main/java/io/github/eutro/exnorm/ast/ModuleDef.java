package io.github.eutro.exnorm.ast;

import io.github.eutro.exnorm.ext.Meta;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A module definition, {@code defmodule name do body end}.
 */
public final class ModuleDef extends Node {
    @NotNull
    public final String name;
    @NotNull
    public final Node body;

    public ModuleDef(String name, Node body, Meta meta) {
        super(meta);
        this.name = Objects.requireNonNull(name, "name");
        this.body = Objects.requireNonNull(body, "body");
    }

    public ModuleDef(String name, Node body) {
        this(name, body, Meta.EMPTY);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitModuleDef(this);
    }

    @Override
    public Node map(UnaryOperator<Node> f) {
        Node body = f.apply(this.body);
        if (body == this.body) return this;
        return new ModuleDef(name, body, meta);
    }

    @Override
    public void forEachChild(Consumer<Node> consumer) {
        consumer.accept(body);
    }

    @Override
    public ModuleDef withMeta(Meta meta) {
        return meta == this.meta ? this : new ModuleDef(name, body, meta);
    }

    @Override
    protected List<?> components() {
        return Arrays.asList(name, body);
    }
}
