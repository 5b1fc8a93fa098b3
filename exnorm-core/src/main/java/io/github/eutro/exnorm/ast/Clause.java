package io.github.eutro.exnorm.ast;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A {@code pattern when guard -> body} clause, of a {@link Case}, {@link Receive},
 * the else section of a {@link With}, or the rescue/catch/else sections of a {@link Try}.
 */
public final class Clause {
    @NotNull
    public final Pattern pattern;
    @Nullable
    public final Node guard;
    @NotNull
    public final Node body;

    public Clause(Pattern pattern, @Nullable Node guard, Node body) {
        this.pattern = Objects.requireNonNull(pattern, "pattern");
        this.guard = guard;
        this.body = Objects.requireNonNull(body, "body");
    }

    public Clause(Pattern pattern, Node body) {
        this(pattern, null, body);
    }

    public Clause map(UnaryOperator<Node> f) {
        Node guard = Nodes.mapNullable(this.guard, f);
        Node body = f.apply(this.body);
        if (guard == this.guard && body == this.body) return this;
        return new Clause(pattern, guard, body);
    }

    public Clause mapPattern(UnaryOperator<Pattern> f) {
        Pattern pattern = f.apply(this.pattern);
        return pattern == this.pattern ? this : new Clause(pattern, guard, body);
    }

    public void forEachChild(Consumer<Node> consumer) {
        Nodes.forNullable(guard, consumer);
        consumer.accept(body);
    }

    public Clause withBody(Node body) {
        return body == this.body ? this : new Clause(pattern, guard, body);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Clause)) return false;
        Clause clause = (Clause) o;
        return pattern.equals(clause.pattern) && Objects.equals(guard, clause.guard) && body.equals(clause.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pattern, guard, body);
    }
}
