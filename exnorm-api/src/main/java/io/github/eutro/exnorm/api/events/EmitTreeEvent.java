package io.github.eutro.exnorm.api.events;

import io.github.eutro.exnorm.api.UnitNormalization;
import io.github.eutro.exnorm.ast.Node;
import org.jetbrains.annotations.NotNull;

/**
 * Fired when a unit has been normalized, and its tree should be printed.
 *
 * @see UnitNormalization
 */
public class EmitTreeEvent extends CancellableEvent implements UnitEvent {
    /**
     * The normalized tree.
     */
    @NotNull
    public Node tree;

    public EmitTreeEvent(@NotNull Node tree) {
        this.tree = tree;
    }
}
