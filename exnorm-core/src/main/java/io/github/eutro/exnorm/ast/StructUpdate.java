package io.github.eutro.exnorm.ast;

import io.github.eutro.exnorm.ext.Meta;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A struct update, {@code %Module{target | field: value}}.
 */
public final class StructUpdate extends Node {
    @NotNull
    public final String module;
    @NotNull
    public final Node target;
    @NotNull
    public final List<Entry> fields;

    public StructUpdate(String module, Node target, List<Entry> fields, Meta meta) {
        super(meta);
        this.module = Objects.requireNonNull(module, "module");
        this.target = Objects.requireNonNull(target, "target");
        this.fields = Nodes.list(fields, "fields");
    }

    public StructUpdate(String module, Node target, List<Entry> fields) {
        this(module, target, fields, Meta.EMPTY);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitStructUpdate(this);
    }

    @Override
    public Node map(UnaryOperator<Node> f) {
        Node target = f.apply(this.target);
        List<Entry> fields = Nodes.mapAll(this.fields, it -> it.map(f));
        if (target == this.target && fields == this.fields) return this;
        return new StructUpdate(module, target, fields, meta);
    }

    @Override
    public void forEachChild(Consumer<Node> consumer) {
        consumer.accept(target);
        for (Entry it : fields) it.forEachChild(consumer);
    }

    @Override
    public StructUpdate withMeta(Meta meta) {
        return meta == this.meta ? this : new StructUpdate(module, target, fields, meta);
    }

    @Override
    protected List<?> components() {
        return Arrays.asList(module, target, fields);
    }
}
