package io.github.eutro.exnorm.passes.dispatch;

import io.github.eutro.exnorm.analysis.Binders;
import io.github.eutro.exnorm.analysis.UsageAnalyzer;
import io.github.eutro.exnorm.ast.*;
import io.github.eutro.exnorm.passes.TreePass;
import io.github.eutro.exnorm.transform.Renamer;
import io.github.eutro.exnorm.transform.Transformer;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * A pass which merges a case clause whose whole body is another case over the variable the
 * clause just bound.
 * <p>
 * <pre>
 * case r do
 *   {:ok, v} -&gt;
 *     case v do
 *       %{id: id} -&gt; id
 *       other -&gt; other
 *     end
 *   {:error, e} -&gt; e
 * end
 * </pre>
 * becomes
 * <pre>
 * case r do
 *   {:ok, %{id: id}} -&gt; id
 *   {:ok, other} -&gt; other
 *   {:error, e} -&gt; e
 * end
 * </pre>
 * The outer clause must be an unguarded tuple pattern binding only {@code v}, and the inner
 * case must end in an unguarded clause that matches anything, so that the merged clauses
 * match exactly what the outer clause did. Where an inner pattern is a variable, reads of
 * {@code v} are renamed to it; otherwise {@code v} stays bound through {@code pattern = v}
 * if it is still read.
 */
public class FlattenNestedCase implements TreePass {
    /**
     * An instance of this pass.
     */
    public static final FlattenNestedCase INSTANCE = new FlattenNestedCase();

    @Override
    public Node run(Node root) {
        return Transformer.transform(root, node -> {
            if (!(node instanceof Case)) return node;
            Case aCase = (Case) node;
            List<Clause> clauses = aCase.clauses;
            for (int i = 0; i < clauses.size(); i++) {
                List<Clause> merged = merge(clauses.get(i));
                if (merged == null) continue;
                List<Clause> out = new ArrayList<>(clauses.subList(0, i));
                out.addAll(merged);
                out.addAll(clauses.subList(i + 1, clauses.size()));
                clauses = out;
                i--;
            }
            return aCase.withClauses(clauses);
        });
    }

    @Nullable
    private static List<Clause> merge(Clause outer) {
        if (outer.guard != null || !(outer.pattern instanceof PTuple)) return null;
        PTuple tuple = (PTuple) outer.pattern;
        int slot = -1;
        for (int i = 0; i < tuple.elements.size(); i++) {
            if (tuple.elements.get(i) instanceof PVar) {
                if (slot != -1) return null;
                slot = i;
            }
        }
        if (slot == -1) return null;
        String v = ((PVar) tuple.elements.get(slot)).name;
        if (Patterns.boundNames(tuple).size() != 1) return null;

        Node body = Nodes.unwrap(outer.body);
        if (!(body instanceof Case)) return null;
        Case inner = (Case) body;
        if (!Nodes.isVar(Nodes.unwrapParens(inner.subject), v) || inner.clauses.isEmpty()) return null;
        Clause last = inner.clauses.get(inner.clauses.size() - 1);
        if (last.guard != null || !Patterns.isIrrefutable(last.pattern)) return null;

        List<Clause> merged = new ArrayList<>(inner.clauses.size());
        for (Clause clause : inner.clauses) {
            if (Patterns.pinnedNames(clause.pattern).contains(v)) return null;
            Clause flat = flatten(tuple, slot, v, clause);
            if (flat == null) return null;
            merged.add(flat);
        }
        return merged;
    }

    @Nullable
    private static Clause flatten(PTuple tuple, int slot, String v, Clause clause) {
        Pattern pattern = clause.pattern;
        Node guard = clause.guard;
        Node body = clause.body;
        boolean read = (guard != null && UsageAnalyzer.isReferencedIn(guard, v)) || UsageAnalyzer.isReferencedIn(body, v);
        Pattern element;
        if (pattern instanceof PVar && !((PVar) pattern).isDiscard()) {
            String p = ((PVar) pattern).name;
            element = pattern;
            if (!p.equals(v) && read) {
                if (Binders.declaredIn(body).contains(p) || guard != null && Binders.declaredIn(guard).contains(p)) {
                    element = new PAlias(v, pattern);
                } else {
                    Node renamedBody = Renamer.rename(body, v, p);
                    Node renamedGuard = guard == null ? null : Renamer.rename(guard, v, p);
                    if (renamedBody == null || guard != null && renamedGuard == null) {
                        element = new PAlias(v, pattern);
                    } else {
                        body = renamedBody;
                        guard = renamedGuard;
                    }
                }
            }
        } else if (pattern instanceof PWildcard) {
            element = read ? new PVar(v) : pattern;
        } else {
            if (Patterns.binds(pattern, v)) return null;
            element = read ? new PAlias(v, pattern) : pattern;
        }
        List<Pattern> elements = new ArrayList<>(tuple.elements);
        elements.set(slot, element);
        return new Clause(new PTuple(elements), guard, body);
    }
}
