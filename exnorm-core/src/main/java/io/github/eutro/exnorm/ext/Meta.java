package io.github.eutro.exnorm.ext;

import io.github.eutro.exnorm.ast.SourcePos;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * The immutable metadata attached to a node: its source position, and a sparse
 * set of {@link Ext} values.
 * <p>
 * Metadata is set once by whichever stage computed it. Every pass must tolerate
 * its absence.
 */
public final class Meta implements ExtContainer {
    /**
     * The version of the metadata key set in {@link CommonExts}.
     */
    public static final int VERSION = 1;

    /**
     * Metadata with no position and no exts.
     */
    public static final Meta EMPTY = new Meta(null, Collections.emptyMap());

    @Nullable
    public final SourcePos pos;
    // sorted by ext creation order, never mutated after construction
    private final Map<Ext<?>, Object> values;

    private Meta(@Nullable SourcePos pos, Map<Ext<?>, Object> values) {
        this.pos = pos;
        this.values = values;
    }

    /**
     * Create metadata with just a source position.
     *
     * @param pos The position.
     * @return The metadata.
     */
    public static Meta at(@Nullable SourcePos pos) {
        return pos == null ? EMPTY : new Meta(pos, Collections.emptyMap());
    }

    /**
     * Create metadata with a single ext.
     *
     * @param ext   The ext.
     * @param value The value.
     * @param <T>   The type of the ext.
     * @return The metadata.
     */
    public static <T> Meta of(Ext<T> ext, T value) {
        return EMPTY.with(ext, value);
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        return (T) values.get(ext);
    }

    /**
     * Return metadata with the given ext associated with the given value.
     *
     * @param ext   The ext.
     * @param value The value, which must be an instance of the ext's type.
     * @param <T>   The type of the ext.
     * @return The new metadata.
     */
    @Contract(pure = true)
    @NotNull
    public <T> Meta with(Ext<T> ext, @NotNull T value) {
        if (!ext.getType().isInstance(value)) {
            throw new IllegalArgumentException("Value " + value + " is not valid for " + ext);
        }
        if (value.equals(values.get(ext))) return this;
        TreeMap<Ext<?>, Object> map = new TreeMap<>(values);
        map.put(ext, value);
        return new Meta(pos, Collections.unmodifiableMap(map));
    }

    /**
     * Return metadata without the given ext.
     *
     * @param ext The ext.
     * @return The new metadata.
     */
    @Contract(pure = true)
    @NotNull
    public Meta without(Ext<?> ext) {
        if (!values.containsKey(ext)) return this;
        TreeMap<Ext<?>, Object> map = new TreeMap<>(values);
        map.remove(ext);
        return map.isEmpty() && pos == null ? EMPTY : new Meta(pos, Collections.unmodifiableMap(map));
    }

    /**
     * Return metadata with a different source position.
     *
     * @param pos The position.
     * @return The new metadata.
     */
    @Contract(pure = true)
    @NotNull
    public Meta withPos(@Nullable SourcePos pos) {
        if (Objects.equals(pos, this.pos)) return this;
        return new Meta(pos, values);
    }

    /**
     * Whether this metadata has no position and no exts.
     *
     * @return Whether it is empty.
     */
    public boolean isEmpty() {
        return pos == null && values.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Meta)) return false;
        Meta meta = (Meta) o;
        return Objects.equals(pos, meta.pos) && values.equals(meta.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pos, values);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Meta{");
        if (pos != null) sb.append(pos);
        values.forEach((ext, value) -> sb.append(sb.length() > 5 ? ", " : "").append(ext.getName()).append('=').append(value));
        return sb.append('}').toString();
    }
}
