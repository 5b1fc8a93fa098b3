package io.github.eutro.exnorm.api.events;

import org.jetbrains.annotations.NotNull;

import java.util.function.Consumer;

/**
 * Something that listeners for events of type {@code S} can be registered on.
 *
 * @param <S> The type of events that can be listened to.
 */
public interface EventDispatcher<S> {
    /**
     * Listen to events of exactly the given class.
     * <p>
     * Listeners for a superclass or subclass of {@code eventClass} are not run.
     *
     * @param eventClass The event class.
     * @param listener   The listener.
     * @param <T>        The event type.
     * @return The registration, which can remove the listener again.
     */
    <T extends S> Registration listen(Class<T> eventClass, @NotNull Consumer<? super T> listener);

    /**
     * A registered listener.
     */
    interface Registration {
        /**
         * Stop the listener from receiving further events. Does nothing if it was already removed.
         */
        void remove();
    }
}
