package io.github.eutro.exnorm.passes.deadstore;

import io.github.eutro.exnorm.ast.*;
import io.github.eutro.exnorm.passes.TreePass;
import io.github.eutro.exnorm.transform.Transformer;

import java.util.ArrayList;
import java.util.List;

/**
 * A pass which removes {@code x = x}.
 * <p>
 * As a statement it is dropped, unless it is the last one, where it becomes {@code x}.
 * Anywhere else it becomes {@code x}.
 */
public class EliminateSelfAssign implements TreePass {
    /**
     * An instance of this pass.
     */
    public static final EliminateSelfAssign INSTANCE = new EliminateSelfAssign();

    @Override
    public Node run(Node root) {
        return Transformer.transform(root, (node, ctx) -> {
            if (node instanceof Block) return eliminate((Block) node);
            if (node instanceof Match && !(ctx.parent() instanceof Block) && isSelfAssign(node)) {
                return ((Match) node).value;
            }
            return node;
        });
    }

    private static Node eliminate(Block block) {
        List<Node> statements = block.statements;
        List<Node> out = null;
        for (int i = 0; i < statements.size(); i++) {
            Node statement = statements.get(i);
            boolean self = isSelfAssign(statement);
            if (self && out == null) out = new ArrayList<>(statements.subList(0, i));
            if (out == null) continue;
            if (!self) {
                out.add(statement);
            } else if (i == statements.size() - 1) {
                out.add(((Match) statement).value);
            }
        }
        return out == null ? block : block.withStatements(out);
    }

    private static boolean isSelfAssign(Node node) {
        if (!(node instanceof Match)) return false;
        Match match = (Match) node;
        return match.pattern instanceof PVar && Nodes.isVar(match.value, ((PVar) match.pattern).name);
    }
}
