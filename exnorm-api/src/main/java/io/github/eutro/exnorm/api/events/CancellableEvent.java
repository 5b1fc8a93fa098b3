package io.github.eutro.exnorm.api.events;

/**
 * Base class of events that a listener can cancel, so that the listeners after it never see them.
 */
public abstract class CancellableEvent {
    private volatile boolean cancelled;

    public boolean isCancelled() {
        return cancelled;
    }

    public void cancel() {
        cancelled = true;
    }
}
