package io.github.eutro.exnorm.passes;

import io.github.eutro.exnorm.ast.Node;

/**
 * A rewrite of a whole tree.
 * <p>
 * Passes are pure functions of the tree and of the configuration they were constructed with.
 * A pass that is unsure whether a shape is safe to rewrite leaves it alone. Running a pass
 * on its own output changes nothing it targets.
 */
public interface TreePass extends IRPass<Node, Node> {
    /**
     * A stable name for this pass, used in logs and errors.
     *
     * @return The name.
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
