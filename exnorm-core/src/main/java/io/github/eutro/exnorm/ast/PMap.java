package io.github.eutro.exnorm.ast;

import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A map pattern, {@code %{k => v}}.
 */
public final class PMap extends Pattern {
    @NotNull
    public final List<PEntry> entries;

    public PMap(List<PEntry> entries) {
        this.entries = Nodes.list(entries, "entries");
    }

    @Override
    public <R> R accept(PatternVisitor<R> visitor) {
        return visitor.visitPMap(this);
    }

    @Override
    public Pattern map(UnaryOperator<Pattern> f) {
        List<PEntry> entries = Nodes.mapAll(this.entries, it -> it.map(f));
        if (entries == this.entries) return this;
        return new PMap(entries);
    }

    @Override
    public void forEachChild(Consumer<Pattern> consumer) {
        for (PEntry it : entries) it.forEachChild(consumer);
    }

    @Override
    protected List<?> components() {
        return Collections.singletonList(entries);
    }
}
