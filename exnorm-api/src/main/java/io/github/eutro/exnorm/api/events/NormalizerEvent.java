package io.github.eutro.exnorm.api.events;

import io.github.eutro.exnorm.api.ElixirNormalizer;

/**
 * An event fired on the {@link ElixirNormalizer normalizer} itself.
 */
public interface NormalizerEvent {
}
