package io.github.eutro.exnorm.ast;

import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A literal pattern. The node is always a literal shape.
 */
public final class PLit extends Pattern {
    @NotNull
    public final Node literal;

    public PLit(Node literal) {
        this.literal = Objects.requireNonNull(literal, "literal");
    }

    @Override
    public <R> R accept(PatternVisitor<R> visitor) {
        return visitor.visitPLit(this);
    }

    @Override
    public Pattern map(UnaryOperator<Pattern> f) {
        return this;
    }

    @Override
    public void forEachChild(Consumer<Pattern> consumer) {
    }

    @Override
    protected List<?> components() {
        return Collections.singletonList(literal);
    }
}
