package io.github.eutro.exnorm.ast;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A {@code key => value} pair of a map, struct or keyword list.
 */
public final class Entry {
    @NotNull
    public final Node key;
    @NotNull
    public final Node value;

    public Entry(Node key, Node value) {
        this.key = Objects.requireNonNull(key, "key");
        this.value = Objects.requireNonNull(value, "value");
    }

    /**
     * An entry with an atom key, as in {@code key: value}.
     *
     * @param key   The atom.
     * @param value The value.
     * @return The entry.
     */
    public static Entry atom(String key, Node value) {
        return new Entry(new Atom(key), value);
    }

    public Entry map(UnaryOperator<Node> f) {
        Node key = f.apply(this.key);
        Node value = f.apply(this.value);
        if (key == this.key && value == this.value) return this;
        return new Entry(key, value);
    }

    public void forEachChild(Consumer<Node> consumer) {
        consumer.accept(key);
        consumer.accept(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Entry)) return false;
        Entry entry = (Entry) o;
        return key.equals(entry.key) && value.equals(entry.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, value);
    }
}
