package io.github.eutro.exnorm.test;

import io.github.eutro.exnorm.ast.*;
import io.github.eutro.exnorm.ext.CommonExts;
import io.github.eutro.exnorm.ext.Meta;
import io.github.eutro.exnorm.ext.NodeRole;
import io.github.eutro.exnorm.passes.fold.AccumulatorAliasUnification;
import io.github.eutro.exnorm.passes.fold.ElementCopyElimination;
import org.junit.jupiter.api.Test;

import java.util.*;

import static io.github.eutro.exnorm.test.Trees.*;
import static org.junit.jupiter.api.Assertions.*;

public class FoldPassesTest {
    private static RemoteCall reduce(Fn reducer) {
        return rcall("Enum", "reduce", v("items"), list(), reducer);
    }

    private static Fn reducer(RemoteCall reduce) {
        return (Fn) reduce.args.get(reduce.args.size() - 1);
    }

    /**
     * Evaluates just enough of the language to run a list-building reducer.
     */
    private static Object eval(Node node, Map<String, Object> env) {
        if (node instanceof Block) {
            Object last = null;
            for (Node statement : ((Block) node).statements) {
                last = eval(statement, env);
            }
            return last;
        }
        if (node instanceof Match) {
            Object value = eval(((Match) node).value, env);
            env.put(((PVar) ((Match) node).pattern).name, value);
            return value;
        }
        if (node instanceof Var) {
            assertTrue(env.containsKey(((Var) node).name), "unbound " + node);
            return env.get(((Var) node).name);
        }
        if (node instanceof IntLit) return ((IntLit) node).value;
        if (node instanceof ListLit) {
            List<Object> values = new ArrayList<>();
            for (Node element : ((ListLit) node).elements) {
                values.add(eval(element, env));
            }
            return values;
        }
        if (node instanceof BinOp) {
            BinOp op = (BinOp) node;
            Object left = eval(op.left, env);
            Object right = eval(op.right, env);
            switch (op.op) {
                case "*":
                    return (Long) left * (Long) right;
                case "++": {
                    List<Object> joined = new ArrayList<>((List<?>) left);
                    joined.addAll((List<?>) right);
                    return joined;
                }
            }
        }
        if (Nodes.isRemoteCall(node, "Enum", "concat")) {
            List<Node> args = ((RemoteCall) node).args;
            List<Object> joined = new ArrayList<>((List<?>) eval(args.get(0), env));
            joined.addAll((List<?>) eval(args.get(1), env));
            return joined;
        }
        throw new IllegalArgumentException("cannot evaluate " + node);
    }

    private static Object fold(Fn reducer, List<Long> items) {
        FnClause clause = reducer.clauses.get(0);
        Object acc = new ArrayList<>();
        for (Long item : items) {
            Map<String, Object> env = new HashMap<>();
            env.put(((PVar) clause.params.get(0)).name, item);
            env.put(((PVar) clause.params.get(1)).name, acc);
            acc = eval(clause.body, env);
        }
        return acc;
    }

    @Test
    void unifyAppendAlias() {
        RemoteCall tree = reduce(fn(params("x", "acc"),
                m("list", v("acc")),
                m("list", op("++", v("list"), list(op("*", v("x"), i(2))))),
                v("list")));
        RemoteCall expected = reduce(fn(params("x", "acc"),
                m("acc", op("++", v("acc"), list(op("*", v("x"), i(2))))),
                v("acc")));
        Node result = AccumulatorAliasUnification.INSTANCE.run(tree);
        assertEquals(expected, result);

        List<Long> items = Arrays.asList(1L, 2L, 3L);
        assertEquals(Arrays.asList(2L, 4L, 6L), fold(reducer(tree), items));
        assertEquals(fold(reducer(tree), items), fold(reducer((RemoteCall) result), items));
    }

    @Test
    void unifyOtherAppendSpellings() {
        RemoteCall concat = reduce(fn(params("x", "acc"),
                m("out", v("acc")),
                m("out", rcall("Enum", "concat", v("out"), list(v("x")))),
                v("out")));
        Node result = AccumulatorAliasUnification.INSTANCE.run(concat);
        assertEquals(reduce(fn(params("x", "acc"),
                m("acc", rcall("Enum", "concat", v("acc"), list(v("x")))),
                v("acc"))), result);
        assertEquals(fold(reducer(concat), Arrays.asList(5L, 7L)), fold(reducer((RemoteCall) result), Arrays.asList(5L, 7L)));

        RemoteCall insert = reduce(fn(params("x", "acc"),
                m("out", v("acc")),
                m("out", rcall("List", "insert_at", v("out"), new UnaryOp("-", i(1)), v("x"))),
                v("out")));
        assertEquals(reduce(fn(params("x", "acc"),
                m("acc", rcall("List", "insert_at", v("acc"), new UnaryOp("-", i(1)), v("x"))),
                v("acc"))), AccumulatorAliasUnification.INSTANCE.run(insert));
    }

    @Test
    void unifyMarkedFoldBody() {
        Fn marked = new Fn(
                Collections.singletonList(fnClause(params("x", "acc"),
                        m("list", v("acc")),
                        m("list", op("++", v("list"), list(v("x")))),
                        v("list"))),
                Meta.of(CommonExts.ROLE, NodeRole.FOLD_BODY));
        Fn result = (Fn) AccumulatorAliasUnification.INSTANCE.run(marked);
        assertEquals(block(m("acc", op("++", v("acc"), list(v("x")))), v("acc")), result.clauses.get(0).body);
        assertTrue(CommonExts.hasRole(result, NodeRole.FOLD_BODY));
    }

    @Test
    void keepAliasWithoutAppendOrWithLaterAccumulator() {
        RemoteCall noAppend = reduce(fn(params("x", "acc"), m("list", v("acc")), v("list")));
        assertSame(noAppend, AccumulatorAliasUnification.INSTANCE.run(noAppend));
        RemoteCall accLater = reduce(fn(params("x", "acc"),
                m("list", v("acc")),
                m("list", op("++", v("list"), list(v("x")))),
                op("++", v("list"), v("acc"))));
        assertSame(accLater, AccumulatorAliasUnification.INSTANCE.run(accLater));
        Node notReducer = rcall("Enum", "map", v("items"), fn(params("x", "acc"),
                m("list", v("acc")),
                m("list", op("++", v("list"), list(v("x")))),
                v("list")));
        assertSame(notReducer, AccumulatorAliasUnification.INSTANCE.run(notReducer));
    }

    @Test
    void eliminateElementCopy() {
        RemoteCall tree = rcall("Enum", "reduce", v("items"), i(0), fn(params("x", "acc"),
                m("item", v("x")),
                op("+", v("acc"), v("item"))));
        RemoteCall expected = rcall("Enum", "reduce", v("items"), i(0), fn(params("x", "acc"),
                block(op("+", v("acc"), v("x")))));
        assertEquals(expected, ElementCopyElimination.INSTANCE.run(tree));
    }

    @Test
    void keepReboundOrFinalElementCopy() {
        RemoteCall rebound = rcall("Enum", "reduce", v("items"), i(0), fn(params("x", "acc"),
                m("item", v("x")),
                m("item", op("+", v("item"), i(1))),
                op("+", v("acc"), v("item"))));
        assertSame(rebound, ElementCopyElimination.INSTANCE.run(rebound));
        RemoteCall last = rcall("Enum", "reduce", v("items"), i(0), fn(params("x", "acc"),
                call("log", v("acc")),
                m("item", v("x"))));
        assertSame(last, ElementCopyElimination.INSTANCE.run(last));
    }
}
