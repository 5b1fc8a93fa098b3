package io.github.eutro.exnorm.passes.fold;

import io.github.eutro.exnorm.analysis.Binders;
import io.github.eutro.exnorm.ast.*;
import io.github.eutro.exnorm.passes.TreePass;
import io.github.eutro.exnorm.transform.Renamer;
import io.github.eutro.exnorm.transform.Transformer;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * A pass which removes local copies of the element in a reducer.
 * <p>
 * In {@code fn elem, acc -> ... end}, a statement {@code x = elem} that is not the last one is
 * removed and {@code x} replaced by {@code elem}, as long as neither name is bound again
 * afterwards.
 */
public class ElementCopyElimination implements TreePass {
    /**
     * An instance of this pass.
     */
    public static final ElementCopyElimination INSTANCE = new ElementCopyElimination();

    @Override
    public Node run(Node root) {
        return Transformer.transform(root, (node, ctx) -> {
            if (!(node instanceof Fn) || !Reducers.isReducer((Fn) node, ctx)) return node;
            Fn fn = (Fn) node;
            FnClause clause = fn.clauses.get(0);
            if (!(clause.params.get(0) instanceof PVar)) return node;
            String elem = ((PVar) clause.params.get(0)).name;
            if (elem.startsWith("_")) return node;
            List<Node> statements = Nodes.statements(clause.body);
            List<Node> eliminated = statements;
            for (int k = 0; k < eliminated.size() - 1; k++) {
                List<Node> next = eliminate(eliminated, k, elem);
                if (next != null) {
                    eliminated = next;
                    k--;
                }
            }
            return eliminated == statements ? node : Reducers.withStatements(fn, eliminated);
        });
    }

    @Nullable
    private static List<Node> eliminate(List<Node> statements, int k, String elem) {
        Node statement = statements.get(k);
        if (!(statement instanceof Match)) return null;
        Match copy = (Match) statement;
        if (!(copy.pattern instanceof PVar) || !Nodes.isVar(copy.value, elem)) return null;
        String name = ((PVar) copy.pattern).name;
        if (name.equals(elem)) return null;
        List<Node> rest = statements.subList(k + 1, statements.size());
        Set<String> rebound = Binders.declaredIn(rest);
        if (rebound.contains(name) || rebound.contains(elem)) return null;
        List<Node> renamed = Renamer.rename(rest, name, elem);
        if (renamed == null) return null;
        List<Node> out = new ArrayList<>(statements.subList(0, k));
        out.addAll(renamed);
        return out;
    }
}
