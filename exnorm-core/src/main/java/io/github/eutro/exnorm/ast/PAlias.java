package io.github.eutro.exnorm.ast;

import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A pattern also bound to a name as a whole, {@code pattern = name}.
 */
public final class PAlias extends Pattern {
    @NotNull
    public final String name;
    @NotNull
    public final Pattern pattern;

    public PAlias(String name, Pattern pattern) {
        this.name = Objects.requireNonNull(name, "name");
        this.pattern = Objects.requireNonNull(pattern, "pattern");
    }

    @Override
    public <R> R accept(PatternVisitor<R> visitor) {
        return visitor.visitPAlias(this);
    }

    @Override
    public Pattern map(UnaryOperator<Pattern> f) {
        Pattern pattern = f.apply(this.pattern);
        if (pattern == this.pattern) return this;
        return new PAlias(name, pattern);
    }

    @Override
    public void forEachChild(Consumer<Pattern> consumer) {
        consumer.accept(pattern);
    }

    @Override
    protected List<?> components() {
        return Arrays.asList(name, pattern);
    }
}
