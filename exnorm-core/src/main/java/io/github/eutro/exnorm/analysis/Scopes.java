package io.github.eutro.exnorm.analysis;

import io.github.eutro.exnorm.ast.*;
import io.github.eutro.exnorm.transform.VisitContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Tells scope bodies from expression positions.
 * <p>
 * A statement list opens a scope when it is the body of a definition, a function clause,
 * a case, cond, with, receive or try clause, an if branch, a comprehension, a module, or the
 * root of the unit. A block anywhere else (a match right-hand side, an argument, parentheses)
 * leaks its bindings into the surrounding scope.
 */
public final class Scopes {
    private Scopes() {
    }

    /**
     * Whether the node being visited sits in a body slot of its parent.
     *
     * @param context The visit context.
     * @return Whether it is a scope body.
     */
    public static boolean isScopeBody(VisitContext context) {
        Node parent = context.parent();
        if (parent == null) return true;
        Node original = context.original();
        for (Node slot : bodySlots(parent)) {
            if (slot == original) return true;
        }
        return false;
    }

    /**
     * The children of a node that are scope bodies.
     *
     * @param node The node.
     * @return The body children.
     */
    public static List<Node> bodySlots(Node node) {
        return node.accept(new NodeVisitor.Default<List<Node>>() {
            @Override
            protected List<Node> visitDefault(Node node) {
                return Collections.emptyList();
            }

            @Override
            public List<Node> visitIf(If node) {
                return branches(node.then, node.otherwise);
            }

            @Override
            public List<Node> visitUnless(Unless node) {
                return branches(node.then, node.otherwise);
            }

            @Override
            public List<Node> visitCond(Cond node) {
                List<Node> slots = new ArrayList<>();
                for (CondClause clause : node.clauses) slots.add(clause.body);
                return slots;
            }

            @Override
            public List<Node> visitCase(Case node) {
                return clauseBodies(new ArrayList<>(), node.clauses);
            }

            @Override
            public List<Node> visitWith(With node) {
                List<Node> slots = new ArrayList<>();
                slots.add(node.body);
                return clauseBodies(slots, node.elseClauses);
            }

            @Override
            public List<Node> visitReceive(Receive node) {
                List<Node> slots = clauseBodies(new ArrayList<>(), node.clauses);
                if (node.afterBody != null) slots.add(node.afterBody);
                return slots;
            }

            @Override
            public List<Node> visitFn(Fn node) {
                List<Node> slots = new ArrayList<>();
                for (FnClause clause : node.clauses) slots.add(clause.body);
                return slots;
            }

            @Override
            public List<Node> visitDef(Def node) {
                return Collections.singletonList(node.body);
            }

            @Override
            public List<Node> visitFor(For node) {
                return Collections.singletonList(node.body);
            }

            @Override
            public List<Node> visitTry(Try node) {
                List<Node> slots = new ArrayList<>();
                slots.add(node.body);
                clauseBodies(slots, node.rescueClauses);
                clauseBodies(slots, node.catchClauses);
                clauseBodies(slots, node.elseClauses);
                if (node.after != null) slots.add(node.after);
                return slots;
            }

            @Override
            public List<Node> visitModuleDef(ModuleDef node) {
                return Collections.singletonList(node.body);
            }
        });
    }

    private static List<Node> branches(Node then, Node otherwise) {
        List<Node> slots = new ArrayList<>(2);
        slots.add(then);
        if (otherwise != null) slots.add(otherwise);
        return slots;
    }

    private static List<Node> clauseBodies(List<Node> slots, List<Clause> clauses) {
        for (Clause clause : clauses) slots.add(clause.body);
        return slots;
    }
}
