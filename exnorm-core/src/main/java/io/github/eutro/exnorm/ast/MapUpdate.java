package io.github.eutro.exnorm.ast;

import io.github.eutro.exnorm.ext.Meta;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A map update, {@code %{map | k => v}}.
 */
public final class MapUpdate extends Node {
    @NotNull
    public final Node map;
    @NotNull
    public final List<Entry> entries;

    public MapUpdate(Node map, List<Entry> entries, Meta meta) {
        super(meta);
        this.map = Objects.requireNonNull(map, "map");
        this.entries = Nodes.list(entries, "entries");
    }

    public MapUpdate(Node map, List<Entry> entries) {
        this(map, entries, Meta.EMPTY);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitMapUpdate(this);
    }

    @Override
    public Node map(UnaryOperator<Node> f) {
        Node map = f.apply(this.map);
        List<Entry> entries = Nodes.mapAll(this.entries, it -> it.map(f));
        if (map == this.map && entries == this.entries) return this;
        return new MapUpdate(map, entries, meta);
    }

    @Override
    public void forEachChild(Consumer<Node> consumer) {
        consumer.accept(map);
        for (Entry it : entries) it.forEachChild(consumer);
    }

    @Override
    public MapUpdate withMeta(Meta meta) {
        return meta == this.meta ? this : new MapUpdate(map, entries, meta);
    }

    @Override
    protected List<?> components() {
        return Arrays.asList(map, entries);
    }
}
