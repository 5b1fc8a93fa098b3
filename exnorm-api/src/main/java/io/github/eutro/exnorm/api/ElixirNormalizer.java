package io.github.eutro.exnorm.api;

import io.github.eutro.exnorm.api.events.*;
import io.github.eutro.exnorm.ast.Node;
import io.github.eutro.exnorm.conf.NormalizerConfig;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Entry point for normalizing generated trees.
 * <p>
 * Each submitted tree becomes a {@link UnitNormalization}, which is independent of every other;
 * units can be run in any order, and in parallel.
 */
public class ElixirNormalizer extends EventSupplier<NormalizerEvent> {
    private static final Logger LOGGER = LoggerFactory.getLogger(ElixirNormalizer.class);

    private final NormalizerConfig baseConfig;

    public ElixirNormalizer() {
        this(NormalizerConfig.DEFAULT);
    }

    /**
     * Create a normalizer whose units start from the given configuration.
     *
     * @param baseConfig The configuration each unit starts from, before {@link ModifyConfigEvent}.
     */
    public ElixirNormalizer(@NotNull NormalizerConfig baseConfig) {
        this.baseConfig = baseConfig;
    }

    public NormalizerConfig getBaseConfig() {
        return baseConfig;
    }

    // it's not, but show a warning if the result is unused
    @Contract(pure = true)
    @NotNull
    public UnitNormalization submit(@NotNull Node tree) {
        return new UnitNormalization(this, tree);
    }

    /**
     * Normalize every unit, returning the results in the same order.
     *
     * @param trees    The units.
     * @param parallel Whether to normalize the units on a parallel stream.
     * @return The normalized trees.
     */
    public List<Node> normalizeAll(List<Node> trees, boolean parallel) {
        LOGGER.debug("Normalizing {} units{}", trees.size(), parallel ? " in parallel" : "");
        Stream<Node> stream = parallel ? trees.parallelStream() : trees.stream();
        return stream
                .map(tree -> submit(tree).run())
                .collect(Collectors.toList());
    }

    public List<Node> normalizeAll(List<Node> trees) {
        return normalizeAll(trees, false);
    }

    /**
     * Get a dispatcher that registers listeners on every unit this normalizer runs from now on.
     * <p>
     * Removing a registration made through it stops the listener being added to later units;
     * units already running keep it.
     *
     * @return The dispatcher.
     */
    public EventDispatcher<UnitEvent> lift() {
        return new EventDispatcher<UnitEvent>() {
            @Override
            public <T extends UnitEvent> Registration listen(Class<T> eventClass, @NotNull Consumer<? super T> listener) {
                return ElixirNormalizer.this.listen(RunUnitNormalizationEvent.class, evt ->
                        evt.normalization.listen(eventClass, listener));
            }
        };
    }

    public BlockingQueue<Node> outputsAsQueue() {
        BlockingQueue<Node> queue = new LinkedBlockingQueue<>();
        lift().listen(EmitTreeEvent.class, evt -> queue.add(evt.tree));
        return queue;
    }
}
