package io.github.eutro.exnorm.ast;

import io.github.eutro.exnorm.ext.Meta;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A tuple, {@code {a, b}}.
 */
public final class Tuple extends Node {
    @NotNull
    public final List<Node> elements;

    public Tuple(List<Node> elements, Meta meta) {
        super(meta);
        this.elements = Nodes.list(elements, "elements");
    }

    public Tuple(List<Node> elements) {
        this(elements, Meta.EMPTY);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitTuple(this);
    }

    @Override
    public Node map(UnaryOperator<Node> f) {
        List<Node> elements = Nodes.mapAll(this.elements, f);
        if (elements == this.elements) return this;
        return new Tuple(elements, meta);
    }

    @Override
    public void forEachChild(Consumer<Node> consumer) {
        elements.forEach(consumer);
    }

    @Override
    public Tuple withMeta(Meta meta) {
        return meta == this.meta ? this : new Tuple(elements, meta);
    }

    @Override
    protected List<?> components() {
        return Collections.singletonList(elements);
    }
}
