package io.github.eutro.exnorm.api.events;

import io.github.eutro.exnorm.ast.Node;
import io.github.eutro.exnorm.passes.TreePass;
import org.jetbrains.annotations.NotNull;

/**
 * Fired after each pass of the pipeline has run on a unit.
 */
public class PassAppliedEvent implements UnitEvent {
    /**
     * The position of the pass in the pipeline.
     */
    public final int index;
    @NotNull
    public final TreePass pass;
    @NotNull
    public final Node before;
    @NotNull
    public final Node after;

    public PassAppliedEvent(int index, @NotNull TreePass pass, @NotNull Node before, @NotNull Node after) {
        this.index = index;
        this.pass = pass;
        this.before = before;
        this.after = after;
    }

    /**
     * Whether the pass changed the tree.
     *
     * @return Whether the tree after the pass differs from the tree before it.
     */
    public boolean changed() {
        return before != after && !before.equals(after);
    }
}
