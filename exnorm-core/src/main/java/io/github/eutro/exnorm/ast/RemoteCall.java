package io.github.eutro.exnorm.ast;

import io.github.eutro.exnorm.ext.Meta;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A call to a function of another module, {@code module.function(args)}.
 */
public final class RemoteCall extends Node {
    @NotNull
    public final Node module;
    @NotNull
    public final String function;
    @NotNull
    public final List<Node> args;

    public RemoteCall(Node module, String function, List<Node> args, Meta meta) {
        super(meta);
        this.module = Objects.requireNonNull(module, "module");
        this.function = Objects.requireNonNull(function, "function");
        this.args = Nodes.list(args, "args");
    }

    public RemoteCall(Node module, String function, List<Node> args) {
        this(module, function, args, Meta.EMPTY);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitRemoteCall(this);
    }

    @Override
    public Node map(UnaryOperator<Node> f) {
        Node module = f.apply(this.module);
        List<Node> args = Nodes.mapAll(this.args, f);
        if (module == this.module && args == this.args) return this;
        return new RemoteCall(module, function, args, meta);
    }

    @Override
    public void forEachChild(Consumer<Node> consumer) {
        consumer.accept(module);
        args.forEach(consumer);
    }

    @Override
    public RemoteCall withMeta(Meta meta) {
        return meta == this.meta ? this : new RemoteCall(module, function, args, meta);
    }

    @Override
    protected List<?> components() {
        return Arrays.asList(module, function, args);
    }

    public RemoteCall withArgs(List<Node> args) {
        return args == this.args ? this : new RemoteCall(module, function, args, meta);
    }
}
