package io.github.eutro.exnorm.api;

import io.github.eutro.exnorm.api.events.*;
import io.github.eutro.exnorm.ast.Node;
import io.github.eutro.exnorm.conf.NormalizerConfig;
import io.github.eutro.exnorm.passes.Pipeline;
import org.jetbrains.annotations.NotNull;

/**
 * The normalization of a single unit.
 * <p>
 * When {@link #run()} is called, the following events are fired, in order:
 * <ul>
 *     <li>{@link RunUnitNormalizationEvent}, on the normalizer.</li>
 *     <li>{@link ModifyConfigEvent}, once.</li>
 *     <li>{@link PassAppliedEvent}, once for each pass in the pipeline.</li>
 *     <li>{@link EmitTreeEvent}, once, with the final tree.</li>
 * </ul>
 */
public class UnitNormalization extends EventSupplier<UnitEvent> {
    private final ElixirNormalizer normalizer;
    private final Node tree;

    UnitNormalization(ElixirNormalizer normalizer, Node tree) {
        this.normalizer = normalizer;
        this.tree = tree;
    }

    /**
     * Run the normalization, firing events.
     *
     * @return The normalized tree.
     */
    public Node run() {
        normalizer.dispatch(new RunUnitNormalizationEvent(this));
        NormalizerConfig config = dispatch(new ModifyConfigEvent(normalizer.getBaseConfig().toBuilder()))
                .configBuilder
                .build();
        Node result = Pipeline.of(config).run(tree, (index, pass, before, after) ->
                dispatch(new PassAppliedEvent(index, pass, before, after)));
        dispatch(new EmitTreeEvent(result));
        return result;
    }

    /**
     * Set the project module that app-local module references are qualified with.
     *
     * @param projectModule The project module, e.g. {@code "MyApp"}.
     * @return This, for convenience.
     */
    public UnitNormalization setProjectModule(@NotNull String projectModule) {
        listen(ModifyConfigEvent.class, evt -> evt.configBuilder.setProjectModule(projectModule));
        return this;
    }
}
