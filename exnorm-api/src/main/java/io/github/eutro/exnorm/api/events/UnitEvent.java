package io.github.eutro.exnorm.api.events;

import io.github.eutro.exnorm.api.UnitNormalization;

/**
 * An event fired during the normalization of a single unit.
 *
 * @see UnitNormalization
 */
public interface UnitEvent {
}
