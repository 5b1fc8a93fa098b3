package io.github.eutro.exnorm.ast;

import io.github.eutro.exnorm.ext.Meta;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A call to a local or imported function.
 */
public final class Call extends Node {
    @NotNull
    public final String name;
    @NotNull
    public final List<Node> args;

    public Call(String name, List<Node> args, Meta meta) {
        super(meta);
        this.name = Objects.requireNonNull(name, "name");
        this.args = Nodes.list(args, "args");
    }

    public Call(String name, List<Node> args) {
        this(name, args, Meta.EMPTY);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitCall(this);
    }

    @Override
    public Node map(UnaryOperator<Node> f) {
        List<Node> args = Nodes.mapAll(this.args, f);
        if (args == this.args) return this;
        return new Call(name, args, meta);
    }

    @Override
    public void forEachChild(Consumer<Node> consumer) {
        args.forEach(consumer);
    }

    @Override
    public Call withMeta(Meta meta) {
        return meta == this.meta ? this : new Call(name, args, meta);
    }

    @Override
    protected List<?> components() {
        return Arrays.asList(name, args);
    }
}
