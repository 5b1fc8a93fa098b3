package io.github.eutro.exnorm.passes.shape;

import io.github.eutro.exnorm.ast.*;
import io.github.eutro.exnorm.passes.TreePass;
import io.github.eutro.exnorm.transform.Transformer;

/**
 * A pass which removes {@code else nil} from {@code if} and {@code unless}, which is the default.
 */
public class DropNilElse implements TreePass {
    /**
     * An instance of this pass.
     */
    public static final DropNilElse INSTANCE = new DropNilElse();

    @Override
    public Node run(Node root) {
        return Transformer.transform(root, node -> {
            if (node instanceof If) {
                If anIf = (If) node;
                if (isNil(anIf.otherwise)) return new If(anIf.condition, anIf.then, null, anIf.meta);
            } else if (node instanceof Unless) {
                Unless unless = (Unless) node;
                if (isNil(unless.otherwise)) return new Unless(unless.condition, unless.then, null, unless.meta);
            }
            return node;
        });
    }

    private static boolean isNil(Node node) {
        return node != null && Nodes.unwrap(node) instanceof Nil;
    }
}
