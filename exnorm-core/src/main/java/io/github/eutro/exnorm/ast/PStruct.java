package io.github.eutro.exnorm.ast;

import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A struct pattern, {@code %Module{field: p}}.
 */
public final class PStruct extends Pattern {
    @NotNull
    public final String module;
    @NotNull
    public final List<PEntry> entries;

    public PStruct(String module, List<PEntry> entries) {
        this.module = Objects.requireNonNull(module, "module");
        this.entries = Nodes.list(entries, "entries");
    }

    @Override
    public <R> R accept(PatternVisitor<R> visitor) {
        return visitor.visitPStruct(this);
    }

    @Override
    public Pattern map(UnaryOperator<Pattern> f) {
        List<PEntry> entries = Nodes.mapAll(this.entries, it -> it.map(f));
        if (entries == this.entries) return this;
        return new PStruct(module, entries);
    }

    @Override
    public void forEachChild(Consumer<Pattern> consumer) {
        for (PEntry it : entries) it.forEachChild(consumer);
    }

    @Override
    protected List<?> components() {
        return Arrays.asList(module, entries);
    }
}
