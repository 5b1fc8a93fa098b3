package io.github.eutro.exnorm.passes.fold;

import io.github.eutro.exnorm.ast.*;
import io.github.eutro.exnorm.ext.CommonExts;
import io.github.eutro.exnorm.ext.NodeRole;
import io.github.eutro.exnorm.transform.VisitContext;

import java.util.Collections;
import java.util.List;

/**
 * Recognizes the reducer functions of folds.
 */
final class Reducers {
    private Reducers() {
    }

    /**
     * Whether the function being visited is the reducer of {@code Enum.reduce} or
     * {@code Enum.reduce_while}, or was marked as a fold body by the front end.
     *
     * @param fn  The function.
     * @param ctx The visit context.
     * @return Whether it is a reducer with one two-parameter clause.
     */
    static boolean isReducer(Fn fn, VisitContext ctx) {
        if (fn.clauses.size() != 1 || fn.clauses.get(0).params.size() != 2) return false;
        if (CommonExts.hasRole(fn, NodeRole.FOLD_BODY)) return true;
        Node parent = ctx.parent();
        if (!Nodes.isRemoteCall(parent, "Enum", "reduce") && !Nodes.isRemoteCall(parent, "Enum", "reduce_while")) {
            return false;
        }
        List<Node> args = ((RemoteCall) parent).args;
        return !args.isEmpty() && args.get(args.size() - 1) == ctx.original();
    }

    static Fn withStatements(Fn fn, List<Node> statements) {
        FnClause clause = fn.clauses.get(0);
        Node body = clause.body instanceof Block
                ? ((Block) clause.body).withStatements(statements)
                : Nodes.sequence(statements, clause.body.meta);
        return fn.withClauses(Collections.singletonList(clause.withBody(body)));
    }
}
