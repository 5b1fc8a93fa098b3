package io.github.eutro.exnorm.ast;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A {@code key => pattern} pair of a {@link PMap} or {@link PStruct}.
 * The key is a literal or pinned pattern.
 */
public final class PEntry {
    @NotNull
    public final Pattern key;
    @NotNull
    public final Pattern value;

    public PEntry(Pattern key, Pattern value) {
        this.key = Objects.requireNonNull(key, "key");
        this.value = Objects.requireNonNull(value, "value");
    }

    public static PEntry atom(String key, Pattern value) {
        return new PEntry(new PLit(new Atom(key)), value);
    }

    public PEntry map(UnaryOperator<Pattern> f) {
        Pattern key = f.apply(this.key);
        Pattern value = f.apply(this.value);
        if (key == this.key && value == this.value) return this;
        return new PEntry(key, value);
    }

    public void forEachChild(Consumer<Pattern> consumer) {
        consumer.accept(key);
        consumer.accept(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PEntry)) return false;
        PEntry entry = (PEntry) o;
        return key.equals(entry.key) && value.equals(entry.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, value);
    }
}
