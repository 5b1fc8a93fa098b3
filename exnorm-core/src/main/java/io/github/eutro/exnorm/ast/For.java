package io.github.eutro.exnorm.ast;

import io.github.eutro.exnorm.ext.Meta;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A comprehension, {@code for generators, filters, into: into do body end}.
 */
public final class For extends Node {
    @NotNull
    public final List<Generator> generators;
    @NotNull
    public final List<Node> filters;
    @Nullable
    public final Node into;
    @NotNull
    public final Node body;

    public For(List<Generator> generators, List<Node> filters, @Nullable Node into, Node body, Meta meta) {
        super(meta);
        this.generators = Nodes.list(generators, "generators");
        this.filters = Nodes.list(filters, "filters");
        this.into = into;
        this.body = Objects.requireNonNull(body, "body");
    }

    public For(List<Generator> generators, List<Node> filters, @Nullable Node into, Node body) {
        this(generators, filters, into, body, Meta.EMPTY);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitFor(this);
    }

    @Override
    public Node map(UnaryOperator<Node> f) {
        List<Generator> generators = Nodes.mapAll(this.generators, it -> it.map(f));
        List<Node> filters = Nodes.mapAll(this.filters, f);
        Node into = Nodes.mapNullable(this.into, f);
        Node body = f.apply(this.body);
        if (generators == this.generators && filters == this.filters && into == this.into && body == this.body) return this;
        return new For(generators, filters, into, body, meta);
    }

    @Override
    public void forEachChild(Consumer<Node> consumer) {
        for (Generator it : generators) it.forEachChild(consumer);
        filters.forEach(consumer);
        Nodes.forNullable(into, consumer);
        consumer.accept(body);
    }

    @Override
    public void forEachPattern(Consumer<Pattern> consumer) {
        for (Generator it : generators) consumer.accept(it.pattern);
    }

    @Override
    public Node mapPatterns(UnaryOperator<Pattern> f) {
        List<Generator> generators = Nodes.mapAll(this.generators, it -> it.mapPattern(f));
        if (generators == this.generators) return this;
        return new For(generators, filters, into, body, meta);
    }

    @Override
    public For withMeta(Meta meta) {
        return meta == this.meta ? this : new For(generators, filters, into, body, meta);
    }

    @Override
    protected List<?> components() {
        return Arrays.asList(generators, filters, into, body);
    }
}
