package io.github.eutro.exnorm.ast;

import io.github.eutro.exnorm.ext.Meta;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A {@code case subject do ... end} dispatch.
 */
public final class Case extends Node {
    @NotNull
    public final Node subject;
    @NotNull
    public final List<Clause> clauses;

    public Case(Node subject, List<Clause> clauses, Meta meta) {
        super(meta);
        this.subject = Objects.requireNonNull(subject, "subject");
        this.clauses = Nodes.list(clauses, "clauses");
    }

    public Case(Node subject, List<Clause> clauses) {
        this(subject, clauses, Meta.EMPTY);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitCase(this);
    }

    @Override
    public Node map(UnaryOperator<Node> f) {
        Node subject = f.apply(this.subject);
        List<Clause> clauses = Nodes.mapAll(this.clauses, it -> it.map(f));
        if (subject == this.subject && clauses == this.clauses) return this;
        return new Case(subject, clauses, meta);
    }

    @Override
    public void forEachChild(Consumer<Node> consumer) {
        consumer.accept(subject);
        for (Clause it : clauses) it.forEachChild(consumer);
    }

    @Override
    public void forEachPattern(Consumer<Pattern> consumer) {
        for (Clause it : clauses) consumer.accept(it.pattern);
    }

    @Override
    public Node mapPatterns(UnaryOperator<Pattern> f) {
        List<Clause> clauses = Nodes.mapAll(this.clauses, it -> it.mapPattern(f));
        if (clauses == this.clauses) return this;
        return new Case(subject, clauses, meta);
    }

    @Override
    public Case withMeta(Meta meta) {
        return meta == this.meta ? this : new Case(subject, clauses, meta);
    }

    @Override
    protected List<?> components() {
        return Arrays.asList(subject, clauses);
    }

    public Case withClauses(List<Clause> clauses) {
        return clauses == this.clauses ? this : new Case(subject, clauses, meta);
    }
}
