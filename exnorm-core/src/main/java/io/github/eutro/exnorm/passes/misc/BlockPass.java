package io.github.eutro.exnorm.passes.misc;

import io.github.eutro.exnorm.analysis.Scopes;
import io.github.eutro.exnorm.ast.Block;
import io.github.eutro.exnorm.ast.Node;
import io.github.eutro.exnorm.passes.TreePass;
import io.github.eutro.exnorm.transform.Transformer;
import io.github.eutro.exnorm.transform.VisitContext;

import java.util.List;

/**
 * A pass which rewrites the statement lists of blocks, one block at a time.
 * <p>
 * A rewrite may only look at the statements of the block it is given.
 */
public abstract class BlockPass implements TreePass {
    private final boolean scopesOnly;

    /**
     * @param scopesOnly Whether to only rewrite blocks which are scope bodies, leaving blocks
     *                   in expression position (whose bindings leak) alone.
     */
    protected BlockPass(boolean scopesOnly) {
        this.scopesOnly = scopesOnly;
    }

    @Override
    public Node run(Node root) {
        return Transformer.transform(root, (node, ctx) -> {
            if (!(node instanceof Block)) return node;
            if (scopesOnly && !Scopes.isScopeBody(ctx)) return node;
            Block block = (Block) node;
            return block.withStatements(rewrite(block.statements, ctx));
        });
    }

    /**
     * Rewrite the statements of a block.
     *
     * @param statements The statements.
     * @param ctx        The context of the block.
     * @return The new statements, or the same list if nothing changed.
     */
    protected abstract List<Node> rewrite(List<Node> statements, VisitContext ctx);
}
