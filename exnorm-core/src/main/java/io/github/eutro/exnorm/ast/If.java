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
 * An {@code if condition do then else otherwise end} expression.
 */
public final class If extends Node {
    @NotNull
    public final Node condition;
    @NotNull
    public final Node then;
    @Nullable
    public final Node otherwise;

    public If(Node condition, Node then, @Nullable Node otherwise, Meta meta) {
        super(meta);
        this.condition = Objects.requireNonNull(condition, "condition");
        this.then = Objects.requireNonNull(then, "then");
        this.otherwise = otherwise;
    }

    public If(Node condition, Node then, @Nullable Node otherwise) {
        this(condition, then, otherwise, Meta.EMPTY);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitIf(this);
    }

    @Override
    public Node map(UnaryOperator<Node> f) {
        Node condition = f.apply(this.condition);
        Node then = f.apply(this.then);
        Node otherwise = Nodes.mapNullable(this.otherwise, f);
        if (condition == this.condition && then == this.then && otherwise == this.otherwise) return this;
        return new If(condition, then, otherwise, meta);
    }

    @Override
    public void forEachChild(Consumer<Node> consumer) {
        consumer.accept(condition);
        consumer.accept(then);
        Nodes.forNullable(otherwise, consumer);
    }

    @Override
    public If withMeta(Meta meta) {
        return meta == this.meta ? this : new If(condition, then, otherwise, meta);
    }

    @Override
    protected List<?> components() {
        return Arrays.asList(condition, then, otherwise);
    }
}
