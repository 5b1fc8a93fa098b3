package io.github.eutro.exnorm.ast;

import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A list pattern with a tail, {@code [h | t]}.
 */
public final class PCons extends Pattern {
    @NotNull
    public final List<Pattern> heads;
    @NotNull
    public final Pattern tail;

    public PCons(List<Pattern> heads, Pattern tail) {
        this.heads = Nodes.list(heads, "heads");
        this.tail = Objects.requireNonNull(tail, "tail");
    }

    @Override
    public <R> R accept(PatternVisitor<R> visitor) {
        return visitor.visitPCons(this);
    }

    @Override
    public Pattern map(UnaryOperator<Pattern> f) {
        List<Pattern> heads = Nodes.mapAll(this.heads, f);
        Pattern tail = f.apply(this.tail);
        if (heads == this.heads && tail == this.tail) return this;
        return new PCons(heads, tail);
    }

    @Override
    public void forEachChild(Consumer<Pattern> consumer) {
        heads.forEach(consumer);
        consumer.accept(tail);
    }

    @Override
    protected List<?> components() {
        return Arrays.asList(heads, tail);
    }
}
