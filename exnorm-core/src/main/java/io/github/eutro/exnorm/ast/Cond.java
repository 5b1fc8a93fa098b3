package io.github.eutro.exnorm.ast;

import io.github.eutro.exnorm.ext.Meta;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A {@code cond do ... end} expression.
 */
public final class Cond extends Node {
    @NotNull
    public final List<CondClause> clauses;

    public Cond(List<CondClause> clauses, Meta meta) {
        super(meta);
        this.clauses = Nodes.list(clauses, "clauses");
    }

    public Cond(List<CondClause> clauses) {
        this(clauses, Meta.EMPTY);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitCond(this);
    }

    @Override
    public Node map(UnaryOperator<Node> f) {
        List<CondClause> clauses = Nodes.mapAll(this.clauses, it -> it.map(f));
        if (clauses == this.clauses) return this;
        return new Cond(clauses, meta);
    }

    @Override
    public void forEachChild(Consumer<Node> consumer) {
        for (CondClause it : clauses) it.forEachChild(consumer);
    }

    @Override
    public Cond withMeta(Meta meta) {
        return meta == this.meta ? this : new Cond(clauses, meta);
    }

    @Override
    protected List<?> components() {
        return Collections.singletonList(clauses);
    }
}
