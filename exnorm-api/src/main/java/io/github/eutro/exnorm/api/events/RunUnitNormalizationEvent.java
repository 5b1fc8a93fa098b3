package io.github.eutro.exnorm.api.events;

import io.github.eutro.exnorm.api.ElixirNormalizer;
import io.github.eutro.exnorm.api.UnitNormalization;
import org.jetbrains.annotations.NotNull;

/**
 * Fired when a unit normalization is started.
 *
 * @see ElixirNormalizer
 * @see UnitNormalization
 */
public class RunUnitNormalizationEvent implements NormalizerEvent {
    /**
     * The unit normalization.
     */
    @NotNull
    public UnitNormalization normalization;

    public RunUnitNormalizationEvent(@NotNull UnitNormalization normalization) {
        this.normalization = normalization;
    }
}
