package io.github.eutro.exnorm.ext;

import org.jetbrains.annotations.NotNull;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A typed metadata key, that can be associated with a value (of type {@code T})
 * in an {@link ExtContainer}.
 * <p>
 * Exts can only be created inside this package, and all of them are declared in
 * {@link CommonExts}. This keeps the set of metadata fields fixed, so a misspelt
 * field is a compile error rather than a silent miss.
 * <p>
 * Note: The implementation of {@link #compareTo(Ext)} depends
 * on the global order in which exts are {@link #create(Class, String) create}d.
 *
 * @param <T> The type of the ext.
 */
public final class Ext<T> implements Comparable<Ext<?>> {
    private static final AtomicInteger ID_COUNTER = new AtomicInteger(0);

    private final Class<T> type;
    private final int id = ID_COUNTER.getAndIncrement();
    private final String name;

    private Ext(Class<T> type, String name) {
        this.type = type;
        this.name = name;
    }

    /**
     * Creates a new ext, with the subtype of a given class, and the given name.
     * <p>
     * The class given is unimportant for the ext API, but may aid with debugging,
     * and is used to reject values of the wrong type when metadata is attached.
     *
     * @param type The most specific superclass of the type of the ext.
     * @param name The name of the ext.
     * @param <T>  The type of the class.
     * @param <R>  The type of the ext.
     * @return The new ext.
     */
    @SuppressWarnings("unchecked")
    static <T, R extends T> Ext<R> create(Class<T> type, String name) {
        return (Ext<R>) new Ext<>(type, name);
    }

    /**
     * Retrieve the type of the ext that it was {@link #create(Class, String) created} with.
     *
     * @return The type of this ext.
     */
    public Class<T> getType() {
        return type;
    }

    /**
     * Get the name of the ext.
     *
     * @return The name.
     */
    public String getName() {
        return name;
    }

    /**
     * Get the association of this in the given container.
     *
     * @param ec The container.
     * @return The association.
     * @see ExtContainer#getExt(Ext)
     */
    public Optional<T> getIn(ExtContainer ec) {
        return ec.getExt(this);
    }

    @Override
    public int compareTo(@NotNull Ext<?> o) {
        return Integer.compare(id, o.id);
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public String toString() {
        return name + ": " + type.getName();
    }
}
