package io.github.eutro.exnorm.ast;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A clause of an anonymous function: {@code params when guard -> body}.
 */
public final class FnClause {
    @NotNull
    public final List<Pattern> params;
    @Nullable
    public final Node guard;
    @NotNull
    public final Node body;

    public FnClause(List<Pattern> params, @Nullable Node guard, Node body) {
        this.params = Nodes.list(params, "params");
        this.guard = guard;
        this.body = Objects.requireNonNull(body, "body");
    }

    public FnClause(List<Pattern> params, Node body) {
        this(params, null, body);
    }

    public FnClause map(UnaryOperator<Node> f) {
        Node guard = Nodes.mapNullable(this.guard, f);
        Node body = f.apply(this.body);
        if (guard == this.guard && body == this.body) return this;
        return new FnClause(params, guard, body);
    }

    public FnClause mapPatterns(UnaryOperator<Pattern> f) {
        List<Pattern> params = Nodes.mapAll(this.params, f);
        return params == this.params ? this : new FnClause(params, guard, body);
    }

    public void forEachChild(Consumer<Node> consumer) {
        Nodes.forNullable(guard, consumer);
        consumer.accept(body);
    }

    public FnClause withBody(Node body) {
        return body == this.body ? this : new FnClause(params, guard, body);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FnClause)) return false;
        FnClause clause = (FnClause) o;
        return params.equals(clause.params) && Objects.equals(guard, clause.guard) && body.equals(clause.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(params, guard, body);
    }
}
