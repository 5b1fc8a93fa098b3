package io.github.eutro.exnorm.ast;

import io.github.eutro.exnorm.ext.Meta;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A list with a tail, {@code [a, b | tail]}.
 */
public final class Cons extends Node {
    @NotNull
    public final List<Node> heads;
    @NotNull
    public final Node tail;

    public Cons(List<Node> heads, Node tail, Meta meta) {
        super(meta);
        this.heads = Nodes.list(heads, "heads");
        this.tail = Objects.requireNonNull(tail, "tail");
    }

    public Cons(List<Node> heads, Node tail) {
        this(heads, tail, Meta.EMPTY);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitCons(this);
    }

    @Override
    public Node map(UnaryOperator<Node> f) {
        List<Node> heads = Nodes.mapAll(this.heads, f);
        Node tail = f.apply(this.tail);
        if (heads == this.heads && tail == this.tail) return this;
        return new Cons(heads, tail, meta);
    }

    @Override
    public void forEachChild(Consumer<Node> consumer) {
        heads.forEach(consumer);
        consumer.accept(tail);
    }

    @Override
    public Cons withMeta(Meta meta) {
        return meta == this.meta ? this : new Cons(heads, tail, meta);
    }

    @Override
    protected List<?> components() {
        return Arrays.asList(heads, tail);
    }
}
