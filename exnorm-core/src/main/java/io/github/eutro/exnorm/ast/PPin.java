package io.github.eutro.exnorm.ast;

import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A pinned name, {@code ^name}. A read of an existing binding, not a binder.
 */
public final class PPin extends Pattern {
    @NotNull
    public final String name;

    public PPin(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    public <R> R accept(PatternVisitor<R> visitor) {
        return visitor.visitPPin(this);
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
}
