package io.github.eutro.exnorm.ast;

import io.github.eutro.exnorm.ext.Meta;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Field access or zero-arity call, {@code target.name}.
 */
public final class Field extends Node {
    @NotNull
    public final Node target;
    @NotNull
    public final String name;

    public Field(Node target, String name, Meta meta) {
        super(meta);
        this.target = Objects.requireNonNull(target, "target");
        this.name = Objects.requireNonNull(name, "name");
    }

    public Field(Node target, String name) {
        this(target, name, Meta.EMPTY);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitField(this);
    }

    @Override
    public Node map(UnaryOperator<Node> f) {
        Node target = f.apply(this.target);
        if (target == this.target) return this;
        return new Field(target, name, meta);
    }

    @Override
    public void forEachChild(Consumer<Node> consumer) {
        consumer.accept(target);
    }

    @Override
    public Field withMeta(Meta meta) {
        return meta == this.meta ? this : new Field(target, name, meta);
    }

    @Override
    protected List<?> components() {
        return Arrays.asList(target, name);
    }
}
