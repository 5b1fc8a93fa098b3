package io.github.eutro.exnorm.api.events;

import io.github.eutro.exnorm.api.UnitNormalization;
import io.github.eutro.exnorm.conf.NormalizerConfig;
import org.jetbrains.annotations.NotNull;

/**
 * Fired before the pipeline of a unit is built, to adjust the configuration its passes see.
 *
 * @see UnitNormalization
 * @see NormalizerConfig.Builder
 */
public class ModifyConfigEvent implements UnitEvent {
    /**
     * The configuration builder.
     */
    @NotNull
    public NormalizerConfig.Builder configBuilder;

    public ModifyConfigEvent(@NotNull NormalizerConfig.Builder configBuilder) {
        this.configBuilder = configBuilder;
    }
}
