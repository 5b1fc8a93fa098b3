package io.github.eutro.exnorm.ast;

import io.github.eutro.exnorm.ast.display.TreeDisplay;

import java.util.List;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A pattern, on the left of a {@link Match} or at the head of a clause.
 * <p>
 * Every name in a pattern introduces a new binding, unless it is wrapped in a {@link PPin}.
 * Like {@link Node}, the set of shapes is closed and listed in {@link PatternVisitor}.
 */
public abstract class Pattern {
    Pattern() {
    }

    public abstract <R> R accept(PatternVisitor<R> visitor);

    /**
     * Apply a function to every direct sub-pattern, returning this if none changed.
     *
     * @param f The function.
     * @return The mapped pattern.
     */
    public abstract Pattern map(UnaryOperator<Pattern> f);

    public abstract void forEachChild(Consumer<Pattern> consumer);

    protected abstract List<?> components();

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || o.getClass() != getClass()) return false;
        return components().equals(((Pattern) o).components());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode() * 31 + components().hashCode();
    }

    @Override
    public String toString() {
        return TreeDisplay.display(this);
    }
}
