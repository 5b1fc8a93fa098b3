/**
 * Events that occur during a normalization.
 * <p>
 * These can be used to configure the passes, to observe or dump intermediate trees,
 * and to hand the final tree to a printer.
 * <p>
 * The API revolves around {@link io.github.eutro.exnorm.api.events.EventSupplier}s,
 * which can dispatch (or have dispatched on them) events that subclass a specific type.
 */
package io.github.eutro.exnorm.api.events;
