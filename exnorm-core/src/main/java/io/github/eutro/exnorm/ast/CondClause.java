package io.github.eutro.exnorm.ast;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A clause of a {@link Cond}: {@code condition -> body}.
 */
public final class CondClause {
    @NotNull
    public final Node condition;
    @NotNull
    public final Node body;

    public CondClause(Node condition, Node body) {
        this.condition = Objects.requireNonNull(condition, "condition");
        this.body = Objects.requireNonNull(body, "body");
    }

    public CondClause map(UnaryOperator<Node> f) {
        Node condition = f.apply(this.condition);
        Node body = f.apply(this.body);
        if (condition == this.condition && body == this.body) return this;
        return new CondClause(condition, body);
    }

    public void forEachChild(Consumer<Node> consumer) {
        consumer.accept(condition);
        consumer.accept(body);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CondClause)) return false;
        CondClause that = (CondClause) o;
        return condition.equals(that.condition) && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(condition, body);
    }
}
