package io.github.eutro.exnorm.ast;

import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * The {@code _} pattern.
 */
public final class PWildcard extends Pattern {
    public PWildcard() {
    }

    @Override
    public <R> R accept(PatternVisitor<R> visitor) {
        return visitor.visitPWildcard(this);
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
        return Collections.emptyList();
    }
}
