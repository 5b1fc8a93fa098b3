package io.github.eutro.exnorm.ast;

import io.github.eutro.exnorm.ext.Meta;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A struct literal, {@code %Module{field: value}}.
 */
public final class Struct extends Node {
    @NotNull
    public final String module;
    @NotNull
    public final List<Entry> fields;

    public Struct(String module, List<Entry> fields, Meta meta) {
        super(meta);
        this.module = Objects.requireNonNull(module, "module");
        this.fields = Nodes.list(fields, "fields");
    }

    public Struct(String module, List<Entry> fields) {
        this(module, fields, Meta.EMPTY);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitStruct(this);
    }

    @Override
    public Node map(UnaryOperator<Node> f) {
        List<Entry> fields = Nodes.mapAll(this.fields, it -> it.map(f));
        if (fields == this.fields) return this;
        return new Struct(module, fields, meta);
    }

    @Override
    public void forEachChild(Consumer<Node> consumer) {
        for (Entry it : fields) it.forEachChild(consumer);
    }

    @Override
    public Struct withMeta(Meta meta) {
        return meta == this.meta ? this : new Struct(module, fields, meta);
    }

    @Override
    protected List<?> components() {
        return Arrays.asList(module, fields);
    }
}
