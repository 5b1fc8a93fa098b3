package io.github.eutro.exnorm.ast;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A step of a {@link With}: {@code pattern <- expr}, or a bare expression if there is no pattern.
 */
public final class WithStep {
    @Nullable
    public final Pattern pattern;
    @NotNull
    public final Node expr;

    public WithStep(@Nullable Pattern pattern, Node expr) {
        this.pattern = pattern;
        this.expr = Objects.requireNonNull(expr, "expr");
    }

    public WithStep map(UnaryOperator<Node> f) {
        Node expr = f.apply(this.expr);
        return expr == this.expr ? this : new WithStep(pattern, expr);
    }

    public WithStep mapPattern(UnaryOperator<Pattern> f) {
        if (pattern == null) return this;
        Pattern pattern = f.apply(this.pattern);
        return pattern == this.pattern ? this : new WithStep(pattern, expr);
    }

    public void forEachChild(Consumer<Node> consumer) {
        consumer.accept(expr);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WithStep)) return false;
        WithStep step = (WithStep) o;
        return Objects.equals(pattern, step.pattern) && expr.equals(step.expr);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pattern, expr);
    }
}
