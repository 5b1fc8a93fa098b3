package io.github.eutro.exnorm.ast;

import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A variable binder. A name starting with {@code _} is discard-marked.
 */
public final class PVar extends Pattern {
    @NotNull
    public final String name;

    public PVar(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    public <R> R accept(PatternVisitor<R> visitor) {
        return visitor.visitPVar(this);
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
        return Collections.singletonList(name);
    }

    /**
     * Whether this binder is marked as intentionally unused.
     *
     * @return Whether the name starts with an underscore.
     */
    public boolean isDiscard() {
        return name.startsWith("_");
    }
}
