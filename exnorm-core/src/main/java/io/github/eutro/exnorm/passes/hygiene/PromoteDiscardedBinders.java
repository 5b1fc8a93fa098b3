package io.github.eutro.exnorm.passes.hygiene;

import io.github.eutro.exnorm.analysis.Binders;
import io.github.eutro.exnorm.analysis.Scopes;
import io.github.eutro.exnorm.analysis.UsageAnalyzer;
import io.github.eutro.exnorm.ast.*;
import io.github.eutro.exnorm.passes.TreePass;
import io.github.eutro.exnorm.transform.Transformer;
import io.github.eutro.exnorm.transform.VisitContext;

import java.util.ArrayList;
import java.util.List;

/**
 * A pass which removes the discard marker from a binder whose undecorated name is read.
 * <p>
 * When {@code _foo} is bound, never read, and {@code foo} is read later in the same window
 * (the rest of the block, or the guard and body of the clause), the binder becomes {@code foo}.
 * The rename is only done if {@code foo} is not bound anywhere in the enclosing definition.
 */
public class PromoteDiscardedBinders implements TreePass {
    /**
     * An instance of this pass.
     */
    public static final PromoteDiscardedBinders INSTANCE = new PromoteDiscardedBinders();

    @Override
    public Node run(Node root) {
        return Transformer.transform(root, (node, ctx) -> {
            if (node instanceof Block && Scopes.isScopeBody(ctx)) {
                return promoteStatements((Block) node, ctx);
            }
            if (node instanceof Case) {
                Case aCase = (Case) node;
                return aCase.withClauses(Nodes.mapAll(aCase.clauses, c -> promoteClause(c, ctx)));
            }
            if (node instanceof Receive) {
                Receive receive = (Receive) node;
                List<Clause> clauses = Nodes.mapAll(receive.clauses, c -> promoteClause(c, ctx));
                if (clauses == receive.clauses) return node;
                return new Receive(clauses, receive.afterTimeout, receive.afterBody, receive.meta);
            }
            return node;
        });
    }

    private static Node promoteStatements(Block block, VisitContext ctx) {
        List<Node> statements = block.statements;
        List<Node> out = null;
        for (int i = 0; i < statements.size(); i++) {
            Node statement = statements.get(i);
            if (!(statement instanceof Match)) continue;
            Match match = (Match) statement;
            Pattern pattern = match.pattern;
            for (String name : Patterns.boundNames(pattern)) {
                String plain = undecorated(name);
                if (plain == null) continue;
                List<Node> current = out == null ? statements : out;
                if (!UsageAnalyzer.isReferenced(current, i + 1, plain)) continue;
                if (UsageAnalyzer.isReferenced(current, 0, name)) continue;
                if (boundInWindow(current, plain) || boundInDefinition(ctx, plain)) continue;
                pattern = Patterns.renameBinder(pattern, name, plain);
            }
            if (pattern != match.pattern) {
                if (out == null) out = new ArrayList<>(statements);
                out.set(i, match.withPattern(pattern));
            }
        }
        return out == null ? block : block.withStatements(out);
    }

    private static Clause promoteClause(Clause clause, VisitContext ctx) {
        Pattern pattern = clause.pattern;
        for (String name : Patterns.boundNames(pattern)) {
            String plain = undecorated(name);
            if (plain == null) continue;
            if (!readIn(clause, plain) || readIn(clause, name)) continue;
            if (Patterns.boundNames(pattern).contains(plain)
                    || Binders.declaredIn(clause.body).contains(plain)
                    || boundInDefinition(ctx, plain)) {
                continue;
            }
            pattern = Patterns.renameBinder(pattern, name, plain);
        }
        return pattern == clause.pattern ? clause : new Clause(pattern, clause.guard, clause.body);
    }

    private static boolean readIn(Clause clause, String name) {
        return clause.guard != null && UsageAnalyzer.isReferencedIn(clause.guard, name)
                || UsageAnalyzer.isReferencedIn(clause.body, name)
                || UsageAnalyzer.isReadInPattern(clause.pattern, name);
    }

    private static boolean boundInWindow(List<Node> statements, String name) {
        return Binders.declaredIn(statements).contains(name);
    }

    private static boolean boundInDefinition(VisitContext ctx, String name) {
        Node scope = ctx.nearest(Def.class);
        if (scope == null) {
            List<Node> ancestors = ctx.ancestors();
            scope = ancestors.isEmpty() ? ctx.original() : ancestors.get(ancestors.size() - 1);
        }
        return Binders.declaredIn(scope).contains(name);
    }

    private static String undecorated(String name) {
        if (name.length() < 2 || name.charAt(0) != '_' || name.charAt(1) == '_') return null;
        return name.substring(1);
    }
}
