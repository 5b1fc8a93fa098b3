package io.github.eutro.exnorm.passes;

import io.github.eutro.exnorm.ast.Node;

/**
 * Observes a {@link Pipeline} run.
 */
@FunctionalInterface
public interface PassListener {
    PassListener NONE = (index, pass, before, after) -> {
    };

    /**
     * Called after each pass has run.
     *
     * @param index  The position of the pass in the pipeline.
     * @param pass   The pass.
     * @param before The tree the pass was given.
     * @param after  The tree the pass returned.
     */
    void passApplied(int index, TreePass pass, Node before, Node after);
}
