package io.github.eutro.exnorm.passes.shape;

import io.github.eutro.exnorm.ast.*;
import io.github.eutro.exnorm.passes.TreePass;
import io.github.eutro.exnorm.transform.Transformer;

import java.util.ArrayList;
import java.util.List;

/**
 * A pass which turns an {@code if} whose else branch is another {@code if} into a {@code cond}.
 * <p>
 * {@code if a do x else if b do y else z end end} becomes {@code cond do a -> x; b -> y; true -> z end}.
 * A chain ending without an else gets a final {@code true -> nil}. Since the sweep is bottom-up,
 * longer chains are built by prepending to the {@code cond} made from the inner part.
 */
public class IfChainToCond implements TreePass {
    /**
     * An instance of this pass.
     */
    public static final IfChainToCond INSTANCE = new IfChainToCond();

    @Override
    public Node run(Node root) {
        return Transformer.transform(root, node -> {
            if (!(node instanceof If)) return node;
            If outer = (If) node;
            if (outer.otherwise == null) return node;
            Node otherwise = Nodes.unwrap(outer.otherwise);
            List<CondClause> clauses = new ArrayList<>();
            clauses.add(new CondClause(outer.condition, outer.then));
            if (otherwise instanceof If) {
                If inner = (If) otherwise;
                clauses.add(new CondClause(inner.condition, inner.then));
                clauses.add(new CondClause(new Bool(true), inner.otherwise == null ? new Nil() : inner.otherwise));
                return new Cond(clauses, outer.meta);
            }
            if (otherwise instanceof Cond) {
                clauses.addAll(((Cond) otherwise).clauses);
                return new Cond(clauses, outer.meta);
            }
            return node;
        });
    }
}
