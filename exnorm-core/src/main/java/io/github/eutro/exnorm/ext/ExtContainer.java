package io.github.eutro.exnorm.ext;

import org.jetbrains.annotations.Nullable;

import java.util.Optional;

/**
 * A read-only container for {@link Ext}s. See the {@link io.github.eutro.exnorm.ext package-level documentation} for more info.
 */
public interface ExtContainer {
    /**
     * Get the value associated with {@code ext} in this container, or null if not present.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     * @return The value associated with ext in this container.
     */
    <T> @Nullable T getNullable(Ext<T> ext);

    /**
     * Get the value associated with {@code ext} in this container, if any.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     * @return The value associated with the ext in this container.
     * @see #getNullable(Ext)
     */
    default <T> Optional<T> getExt(Ext<T> ext) {
        return Optional.ofNullable(getNullable(ext));
    }

    /**
     * Get the value associated with {@code ext} in this container, or throw an exception if not present.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     * @return The value associated with the ext in this container.
     * @see #getNullable(Ext)
     */
    default <T> T getExtOrThrow(Ext<T> ext) {
        T nullable = getNullable(ext);
        if (nullable != null) return nullable;
        throw new IllegalStateException("Ext not present: " + ext);
    }

    /**
     * Test whether a boolean ext is present and set.
     *
     * @param ext The ext.
     * @return Whether the ext is associated with {@code true}.
     */
    default boolean isFlagged(Ext<Boolean> ext) {
        return Boolean.TRUE.equals(getNullable(ext));
    }
}
