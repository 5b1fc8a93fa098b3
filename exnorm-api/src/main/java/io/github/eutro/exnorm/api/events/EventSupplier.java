package io.github.eutro.exnorm.api.events;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Holds listeners by event class, and fires events at them.
 * <p>
 * Listeners run in the order they were added. Units may be normalized in parallel, so
 * listeners can be added, removed and fired from several threads at once.
 *
 * @param <S> The type of events handled.
 */
public class EventSupplier<S> implements EventDispatcher<S> {
    private final Map<Class<?>, List<Consumer<?>>> listeners = new ConcurrentHashMap<>();

    @Override
    public <T extends S> Registration listen(Class<T> eventClass, @NotNull Consumer<? super T> listener) {
        List<Consumer<?>> forClass = listeners.computeIfAbsent(eventClass, $ -> new CopyOnWriteArrayList<>());
        forClass.add(listener);
        return () -> forClass.remove(listener);
    }

    /**
     * Fire an event at the listeners of its runtime class.
     *
     * @param event The event.
     * @param <T>   The type of the event.
     * @return The event, after every listener has seen it or it was cancelled.
     */
    @SuppressWarnings("unchecked")
    public <T extends S> T dispatch(@NotNull T event) {
        List<Consumer<?>> forClass = listeners.get(event.getClass());
        if (forClass == null) return event;
        for (Consumer<?> listener : forClass) {
            if (event instanceof CancellableEvent && ((CancellableEvent) event).isCancelled()) break;
            ((Consumer<? super T>) listener).accept(event);
        }
        return event;
    }
}
