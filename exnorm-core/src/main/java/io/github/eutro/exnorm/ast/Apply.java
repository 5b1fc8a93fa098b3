package io.github.eutro.exnorm.ast;

import io.github.eutro.exnorm.ext.Meta;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A call of an anonymous function, {@code function.(args)}.
 */
public final class Apply extends Node {
    @NotNull
    public final Node function;
    @NotNull
    public final List<Node> args;

    public Apply(Node function, List<Node> args, Meta meta) {
        super(meta);
        this.function = Objects.requireNonNull(function, "function");
        this.args = Nodes.list(args, "args");
    }

    public Apply(Node function, List<Node> args) {
        this(function, args, Meta.EMPTY);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitApply(this);
    }

    @Override
    public Node map(UnaryOperator<Node> f) {
        Node function = f.apply(this.function);
        List<Node> args = Nodes.mapAll(this.args, f);
        if (function == this.function && args == this.args) return this;
        return new Apply(function, args, meta);
    }

    @Override
    public void forEachChild(Consumer<Node> consumer) {
        consumer.accept(function);
        args.forEach(consumer);
    }

    @Override
    public Apply withMeta(Meta meta) {
        return meta == this.meta ? this : new Apply(function, args, meta);
    }

    @Override
    protected List<?> components() {
        return Arrays.asList(function, args);
    }
}
