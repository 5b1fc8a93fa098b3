package io.github.eutro.exnorm.ast;

import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A tuple pattern.
 */
public final class PTuple extends Pattern {
    @NotNull
    public final List<Pattern> elements;

    public PTuple(List<Pattern> elements) {
        this.elements = Nodes.list(elements, "elements");
    }

    @Override
    public <R> R accept(PatternVisitor<R> visitor) {
        return visitor.visitPTuple(this);
    }

    @Override
    public Pattern map(UnaryOperator<Pattern> f) {
        List<Pattern> elements = Nodes.mapAll(this.elements, f);
        if (elements == this.elements) return this;
        return new PTuple(elements);
    }

    @Override
    public void forEachChild(Consumer<Pattern> consumer) {
        elements.forEach(consumer);
    }

    @Override
    protected List<?> components() {
        return Collections.singletonList(elements);
    }
}
