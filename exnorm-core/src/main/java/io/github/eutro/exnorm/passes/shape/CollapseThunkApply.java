package io.github.eutro.exnorm.passes.shape;

import io.github.eutro.exnorm.analysis.Binders;
import io.github.eutro.exnorm.ast.*;
import io.github.eutro.exnorm.passes.TreePass;
import io.github.eutro.exnorm.transform.Transformer;

/**
 * A pass which replaces an immediately applied zero-arity function, {@code (fn -> e end).()},
 * by its body.
 * <p>
 * Only bodies that bind nothing and contain no opaque text are inlined, since the function
 * body is a scope of its own.
 */
public class CollapseThunkApply implements TreePass {
    /**
     * An instance of this pass.
     */
    public static final CollapseThunkApply INSTANCE = new CollapseThunkApply();

    @Override
    public Node run(Node root) {
        return Transformer.transform(root, node -> {
            if (!(node instanceof Apply)) return node;
            Apply apply = (Apply) node;
            if (!apply.args.isEmpty()) return node;
            Node function = Nodes.unwrapParens(apply.function);
            if (!(function instanceof Fn)) return node;
            Fn fn = (Fn) function;
            if (fn.clauses.size() != 1) return node;
            FnClause clause = fn.clauses.get(0);
            if (!clause.params.isEmpty() || clause.guard != null) return node;
            if (!Binders.declaredIn(clause.body).isEmpty() || containsOpaque(clause.body)) return node;
            return clause.body;
        });
    }

    private static boolean containsOpaque(Node node) {
        if (node instanceof Raw || node instanceof Template) return true;
        boolean[] found = {false};
        node.forEachChild(child -> found[0] |= containsOpaque(child));
        return found[0];
    }
}
