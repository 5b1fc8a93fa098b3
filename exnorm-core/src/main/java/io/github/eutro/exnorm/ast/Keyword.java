package io.github.eutro.exnorm.ast;

import io.github.eutro.exnorm.ext.Meta;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A keyword list, {@code [key: value]}.
 */
public final class Keyword extends Node {
    @NotNull
    public final List<Entry> pairs;

    public Keyword(List<Entry> pairs, Meta meta) {
        super(meta);
        this.pairs = Nodes.list(pairs, "pairs");
    }

    public Keyword(List<Entry> pairs) {
        this(pairs, Meta.EMPTY);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitKeyword(this);
    }

    @Override
    public Node map(UnaryOperator<Node> f) {
        List<Entry> pairs = Nodes.mapAll(this.pairs, it -> it.map(f));
        if (pairs == this.pairs) return this;
        return new Keyword(pairs, meta);
    }

    @Override
    public void forEachChild(Consumer<Node> consumer) {
        for (Entry it : pairs) it.forEachChild(consumer);
    }

    @Override
    public Keyword withMeta(Meta meta) {
        return meta == this.meta ? this : new Keyword(pairs, meta);
    }

    @Override
    protected List<?> components() {
        return Collections.singletonList(pairs);
    }
}
