package io.github.eutro.exnorm.ast;

import io.github.eutro.exnorm.ext.Meta;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A read of a variable.
 */
public final class Var extends Node {
    @NotNull
    public final String name;

    public Var(String name, Meta meta) {
        super(meta);
        this.name = Objects.requireNonNull(name, "name");
    }

    public Var(String name) {
        this(name, Meta.EMPTY);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitVar(this);
    }

    @Override
    public Node map(UnaryOperator<Node> f) {
        return this;
    }

    @Override
    public void forEachChild(Consumer<Node> consumer) {
    }

    @Override
    public Var withMeta(Meta meta) {
        return meta == this.meta ? this : new Var(name, meta);
    }

    @Override
    protected List<?> components() {
        return Collections.singletonList(name);
    }
}
