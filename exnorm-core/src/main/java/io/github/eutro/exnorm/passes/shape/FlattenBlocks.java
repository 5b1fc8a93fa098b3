package io.github.eutro.exnorm.passes.shape;

import io.github.eutro.exnorm.ast.*;
import io.github.eutro.exnorm.passes.TreePass;
import io.github.eutro.exnorm.transform.Transformer;

import java.util.ArrayList;
import java.util.List;

/**
 * A pass which removes block nesting the printer cannot serialize.
 * <p>
 * A block that is a statement of another block is spliced into it, a block of a single
 * statement is replaced by that statement, and doubled parentheses are collapsed.
 */
public class FlattenBlocks implements TreePass {
    /**
     * An instance of this pass.
     */
    public static final FlattenBlocks INSTANCE = new FlattenBlocks();

    @Override
    public Node run(Node root) {
        return Transformer.transform(root, node -> {
            if (node instanceof Block) return flatten((Block) node);
            if (node instanceof Paren && ((Paren) node).inner instanceof Paren) {
                return ((Paren) node).inner;
            }
            return node;
        });
    }

    private static Node flatten(Block block) {
        List<Node> statements = block.statements;
        boolean nested = false;
        for (Node statement : statements) {
            if (spliceable(statement) != null) {
                nested = true;
                break;
            }
        }
        if (nested) {
            List<Node> flat = new ArrayList<>();
            for (int i = 0; i < statements.size(); i++) {
                Node statement = statements.get(i);
                Block inner = spliceable(statement);
                if (inner == null) {
                    flat.add(statement);
                } else if (!inner.statements.isEmpty()) {
                    flat.addAll(inner.statements);
                } else if (i == statements.size() - 1) {
                    flat.add(new Nil(inner.meta));
                }
            }
            statements = flat;
        }
        if (statements.size() == 1) return statements.get(0);
        return block.withStatements(statements);
    }

    private static Block spliceable(Node statement) {
        Node inner = Nodes.unwrapParens(statement);
        return inner instanceof Block ? (Block) inner : null;
    }
}
