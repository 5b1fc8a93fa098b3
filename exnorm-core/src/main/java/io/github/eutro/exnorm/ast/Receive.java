package io.github.eutro.exnorm.ast;

import io.github.eutro.exnorm.ext.Meta;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A {@code receive do ... after timeout -> afterBody end} expression.
 */
public final class Receive extends Node {
    @NotNull
    public final List<Clause> clauses;
    @Nullable
    public final Node afterTimeout;
    @Nullable
    public final Node afterBody;

    public Receive(List<Clause> clauses, @Nullable Node afterTimeout, @Nullable Node afterBody, Meta meta) {
        super(meta);
        this.clauses = Nodes.list(clauses, "clauses");
        this.afterTimeout = afterTimeout;
        this.afterBody = afterBody;
    }

    public Receive(List<Clause> clauses, @Nullable Node afterTimeout, @Nullable Node afterBody) {
        this(clauses, afterTimeout, afterBody, Meta.EMPTY);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitReceive(this);
    }

    @Override
    public Node map(UnaryOperator<Node> f) {
        List<Clause> clauses = Nodes.mapAll(this.clauses, it -> it.map(f));
        Node afterTimeout = Nodes.mapNullable(this.afterTimeout, f);
        Node afterBody = Nodes.mapNullable(this.afterBody, f);
        if (clauses == this.clauses && afterTimeout == this.afterTimeout && afterBody == this.afterBody) return this;
        return new Receive(clauses, afterTimeout, afterBody, meta);
    }

    @Override
    public void forEachChild(Consumer<Node> consumer) {
        for (Clause it : clauses) it.forEachChild(consumer);
        Nodes.forNullable(afterTimeout, consumer);
        Nodes.forNullable(afterBody, consumer);
    }

    @Override
    public void forEachPattern(Consumer<Pattern> consumer) {
        for (Clause it : clauses) consumer.accept(it.pattern);
    }

    @Override
    public Node mapPatterns(UnaryOperator<Pattern> f) {
        List<Clause> clauses = Nodes.mapAll(this.clauses, it -> it.mapPattern(f));
        if (clauses == this.clauses) return this;
        return new Receive(clauses, afterTimeout, afterBody, meta);
    }

    @Override
    public Receive withMeta(Meta meta) {
        return meta == this.meta ? this : new Receive(clauses, afterTimeout, afterBody, meta);
    }

    @Override
    protected List<?> components() {
        return Arrays.asList(clauses, afterTimeout, afterBody);
    }
}
