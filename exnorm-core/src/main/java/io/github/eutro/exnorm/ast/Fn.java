package io.github.eutro.exnorm.ast;

import io.github.eutro.exnorm.ext.Meta;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * An anonymous function, {@code fn ... end}.
 */
public final class Fn extends Node {
    @NotNull
    public final List<FnClause> clauses;

    public Fn(List<FnClause> clauses, Meta meta) {
        super(meta);
        this.clauses = Nodes.list(clauses, "clauses");
    }

    public Fn(List<FnClause> clauses) {
        this(clauses, Meta.EMPTY);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitFn(this);
    }

    @Override
    public Node map(UnaryOperator<Node> f) {
        List<FnClause> clauses = Nodes.mapAll(this.clauses, it -> it.map(f));
        if (clauses == this.clauses) return this;
        return new Fn(clauses, meta);
    }

    @Override
    public void forEachChild(Consumer<Node> consumer) {
        for (FnClause it : clauses) it.forEachChild(consumer);
    }

    @Override
    public void forEachPattern(Consumer<Pattern> consumer) {
        for (FnClause it : clauses) it.params.forEach(consumer);
    }

    @Override
    public Node mapPatterns(UnaryOperator<Pattern> f) {
        List<FnClause> clauses = Nodes.mapAll(this.clauses, it -> it.mapPatterns(f));
        if (clauses == this.clauses) return this;
        return new Fn(clauses, meta);
    }

    @Override
    public Fn withMeta(Meta meta) {
        return meta == this.meta ? this : new Fn(clauses, meta);
    }

    @Override
    protected List<?> components() {
        return Collections.singletonList(clauses);
    }

    public Fn withClauses(List<FnClause> clauses) {
        return clauses == this.clauses ? this : new Fn(clauses, meta);
    }
}
