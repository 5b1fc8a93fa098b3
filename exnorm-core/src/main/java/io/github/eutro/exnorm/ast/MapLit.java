package io.github.eutro.exnorm.ast;

import io.github.eutro.exnorm.ext.Meta;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A map literal, {@code %{k => v}}.
 */
public final class MapLit extends Node {
    @NotNull
    public final List<Entry> entries;

    public MapLit(List<Entry> entries, Meta meta) {
        super(meta);
        this.entries = Nodes.list(entries, "entries");
    }

    public MapLit(List<Entry> entries) {
        this(entries, Meta.EMPTY);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitMapLit(this);
    }

    @Override
    public Node map(UnaryOperator<Node> f) {
        List<Entry> entries = Nodes.mapAll(this.entries, it -> it.map(f));
        if (entries == this.entries) return this;
        return new MapLit(entries, meta);
    }

    @Override
    public void forEachChild(Consumer<Node> consumer) {
        for (Entry it : entries) it.forEachChild(consumer);
    }

    @Override
    public MapLit withMeta(Meta meta) {
        return meta == this.meta ? this : new MapLit(entries, meta);
    }

    @Override
    protected List<?> components() {
        return Collections.singletonList(entries);
    }
}
