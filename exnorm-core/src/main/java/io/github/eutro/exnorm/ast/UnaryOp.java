package io.github.eutro.exnorm.ast;

import io.github.eutro.exnorm.ext.Meta;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A unary operator application.
 */
public final class UnaryOp extends Node {
    @NotNull
    public final String op;
    @NotNull
    public final Node operand;

    public UnaryOp(String op, Node operand, Meta meta) {
        super(meta);
        this.op = Objects.requireNonNull(op, "op");
        this.operand = Objects.requireNonNull(operand, "operand");
    }

    public UnaryOp(String op, Node operand) {
        this(op, operand, Meta.EMPTY);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitUnaryOp(this);
    }

    @Override
    public Node map(UnaryOperator<Node> f) {
        Node operand = f.apply(this.operand);
        if (operand == this.operand) return this;
        return new UnaryOp(op, operand, meta);
    }

    @Override
    public void forEachChild(Consumer<Node> consumer) {
        consumer.accept(operand);
    }

    @Override
    public UnaryOp withMeta(Meta meta) {
        return meta == this.meta ? this : new UnaryOp(op, operand, meta);
    }

    @Override
    protected List<?> components() {
        return Arrays.asList(op, operand);
    }
}
