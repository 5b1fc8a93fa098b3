package io.github.eutro.exnorm.ast;

import io.github.eutro.exnorm.ext.Meta;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A {@code with steps do body else elseClauses end} expression.
 */
public final class With extends Node {
    @NotNull
    public final List<WithStep> steps;
    @NotNull
    public final Node body;
    @NotNull
    public final List<Clause> elseClauses;

    public With(List<WithStep> steps, Node body, List<Clause> elseClauses, Meta meta) {
        super(meta);
        this.steps = Nodes.list(steps, "steps");
        this.body = Objects.requireNonNull(body, "body");
        this.elseClauses = Nodes.list(elseClauses, "elseClauses");
    }

    public With(List<WithStep> steps, Node body, List<Clause> elseClauses) {
        this(steps, body, elseClauses, Meta.EMPTY);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitWith(this);
    }

    @Override
    public Node map(UnaryOperator<Node> f) {
        List<WithStep> steps = Nodes.mapAll(this.steps, it -> it.map(f));
        Node body = f.apply(this.body);
        List<Clause> elseClauses = Nodes.mapAll(this.elseClauses, it -> it.map(f));
        if (steps == this.steps && body == this.body && elseClauses == this.elseClauses) return this;
        return new With(steps, body, elseClauses, meta);
    }

    @Override
    public void forEachChild(Consumer<Node> consumer) {
        for (WithStep it : steps) it.forEachChild(consumer);
        consumer.accept(body);
        for (Clause it : elseClauses) it.forEachChild(consumer);
    }

    @Override
    public void forEachPattern(Consumer<Pattern> consumer) {
        for (WithStep it : steps) if (it.pattern != null) consumer.accept(it.pattern);
        for (Clause it : elseClauses) consumer.accept(it.pattern);
    }

    @Override
    public Node mapPatterns(UnaryOperator<Pattern> f) {
        List<WithStep> steps = Nodes.mapAll(this.steps, it -> it.mapPattern(f));
        List<Clause> elseClauses = Nodes.mapAll(this.elseClauses, it -> it.mapPattern(f));
        if (steps == this.steps && elseClauses == this.elseClauses) return this;
        return new With(steps, body, elseClauses, meta);
    }

    @Override
    public With withMeta(Meta meta) {
        return meta == this.meta ? this : new With(steps, body, elseClauses, meta);
    }

    @Override
    protected List<?> components() {
        return Arrays.asList(steps, body, elseClauses);
    }
}
