package io.github.eutro.exnorm.ast;

import io.github.eutro.exnorm.ext.Meta;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Access by key, {@code target[key]}.
 */
public final class Access extends Node {
    @NotNull
    public final Node target;
    @NotNull
    public final Node key;

    public Access(Node target, Node key, Meta meta) {
        super(meta);
        this.target = Objects.requireNonNull(target, "target");
        this.key = Objects.requireNonNull(key, "key");
    }

    public Access(Node target, Node key) {
        this(target, key, Meta.EMPTY);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitAccess(this);
    }

    @Override
    public Node map(UnaryOperator<Node> f) {
        Node target = f.apply(this.target);
        Node key = f.apply(this.key);
        if (target == this.target && key == this.key) return this;
        return new Access(target, key, meta);
    }

    @Override
    public void forEachChild(Consumer<Node> consumer) {
        consumer.accept(target);
        consumer.accept(key);
    }

    @Override
    public Access withMeta(Meta meta) {
        return meta == this.meta ? this : new Access(target, key, meta);
    }

    @Override
    protected List<?> components() {
        return Arrays.asList(target, key);
    }
}
