package io.github.eutro.exnorm.passes.shape;

import io.github.eutro.exnorm.analysis.Binders;
import io.github.eutro.exnorm.analysis.Scopes;
import io.github.eutro.exnorm.ast.*;
import io.github.eutro.exnorm.passes.TreePass;
import io.github.eutro.exnorm.transform.Transformer;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * A pass which moves the leading statements of a block on the right of an assignment out
 * in front of it.
 * <p>
 * {@code a = (s1; s2; e)} as a statement becomes {@code s1; s2; a = e}. The same applies to
 * an assignment nested in the right-hand side of another, as in {@code a = b = (s1; e)}.
 * The rewrite is skipped if a pin in one of the patterns refers to a name the moved
 * statements bind.
 */
public class HoistBlockAssignment implements TreePass {
    /**
     * An instance of this pass.
     */
    public static final HoistBlockAssignment INSTANCE = new HoistBlockAssignment();

    @Override
    public Node run(Node root) {
        return Transformer.transform(root, (node, ctx) -> {
            if (node instanceof Block) {
                return hoistStatements((Block) node);
            }
            if (node instanceof Match && Scopes.isScopeBody(ctx)) {
                List<Node> out = new ArrayList<>();
                Match hoisted = hoist((Match) node, out);
                if (hoisted == null) return node;
                out.add(hoisted);
                return new Block(out, node.meta);
            }
            return node;
        });
    }

    private static Node hoistStatements(Block block) {
        List<Node> out = null;
        for (int i = 0; i < block.statements.size(); i++) {
            Node statement = block.statements.get(i);
            Match hoisted = null;
            List<Node> moved = new ArrayList<>();
            if (statement instanceof Match) {
                hoisted = hoist((Match) statement, moved);
            }
            if (hoisted != null && out == null) {
                out = new ArrayList<>(block.statements.subList(0, i));
            }
            if (out != null) {
                if (hoisted == null) {
                    out.add(statement);
                } else {
                    out.addAll(moved);
                    out.add(hoisted);
                }
            }
        }
        return out == null ? block : block.withStatements(out);
    }

    /**
     * Hoist the statements out of the right-hand side of a match.
     *
     * @param match The match.
     * @param out   The list to add the hoisted statements to.
     * @return The match without them, or null if there was nothing to hoist or it was unsafe.
     */
    @Nullable
    private static Match hoist(Match match, List<Node> out) {
        List<Node> moved = new ArrayList<>();
        Match hoisted = hoistInto(match, moved);
        if (hoisted == null || moved.isEmpty()) return null;
        Set<String> bound = Binders.declaredIn(moved);
        for (Match m = hoisted; ; m = (Match) m.value) {
            for (String pinned : Patterns.pinnedNames(m.pattern)) {
                if (bound.contains(pinned)) return null;
            }
            if (!(m.value instanceof Match)) break;
        }
        out.addAll(moved);
        return hoisted;
    }

    private static Match hoistInto(Match match, List<Node> moved) {
        Node value = Nodes.unwrapParens(match.value);
        if (value instanceof Block && !((Block) value).statements.isEmpty()) {
            List<Node> statements = ((Block) value).statements;
            moved.addAll(statements.subList(0, statements.size() - 1));
            value = statements.get(statements.size() - 1);
        }
        if (value instanceof Match) {
            value = hoistInto((Match) value, moved);
        }
        if (moved.isEmpty()) return match;
        return match.withValue(value);
    }
}
