package io.github.eutro.exnorm.test;

import io.github.eutro.exnorm.ast.*;
import io.github.eutro.exnorm.passes.shape.*;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static io.github.eutro.exnorm.test.Trees.*;
import static org.junit.jupiter.api.Assertions.*;

public class ShapePassesTest {
    @Test
    void flattenSplicesNestedBlocks() {
        Node tree = block(m("a", i(1)), block(m("b", i(2)), v("c")), new Paren(block()));
        assertEquals(block(m("a", i(1)), m("b", i(2)), v("c"), new Nil()), FlattenBlocks.INSTANCE.run(tree));
    }

    @Test
    void flattenDropsEmptyBlocksAndSingletons() {
        assertEquals(v("x"), FlattenBlocks.INSTANCE.run(block(block(), v("x"))));
        assertEquals(m("a", call("f")), FlattenBlocks.INSTANCE.run(m("a", block(call("f")))));
        assertEquals(new Paren(v("x")), FlattenBlocks.INSTANCE.run(new Paren(new Paren(v("x")))));
    }

    @Test
    void flattenKeepsFlatTrees() {
        Node tree = def("f", params("x"), m("y", call("g", v("x"))), v("y"));
        assertSame(tree, FlattenBlocks.INSTANCE.run(tree));
    }

    @Test
    void hoistFromAssignment() {
        Node tree = def("f", params(),
                m("a", block(m("b", call("compute")), new If(v("cond"), v("t"), v("b")))),
                v("a"));
        Node expected = def("f", params(),
                m("b", call("compute")),
                m("a", new If(v("cond"), v("t"), v("b"))),
                v("a"));
        assertEquals(expected, HoistBlockAssignment.INSTANCE.run(tree));
    }

    @Test
    void hoistThroughChainedAssignment() {
        Node tree = block(m(pv("x"), m("y", block(call("log"), i(1)))), v("x"));
        Node expected = block(call("log"), m(pv("x"), m("y", i(1))), v("x"));
        assertEquals(expected, HoistBlockAssignment.INSTANCE.run(tree));
    }

    @Test
    void hoistSoleBodyStatement() {
        Node tree = def("f", params(), m("a", block(call("log"), i(1))));
        assertEquals(def("f", params(), call("log"), m("a", i(1))), HoistBlockAssignment.INSTANCE.run(tree));
    }

    @Test
    void hoistRefusesPinnedCapture() {
        Node tree = block(m(ptuple(new PPin("b"), pv("z")), block(m("b", i(1)), v("pair"))), v("z"));
        assertSame(tree, HoistBlockAssignment.INSTANCE.run(tree));
    }

    @Test
    void hoistLeavesExpressionPositions() {
        Node tree = call("f", m("a", block(call("log"), i(1))));
        assertSame(tree, HoistBlockAssignment.INSTANCE.run(tree));
    }

    @Test
    void collapseThunk() {
        Node thunk = new Apply(new Paren(fn(params(), call("work", v("x")))), Collections.emptyList());
        assertEquals(call("work", v("x")), CollapseThunkApply.INSTANCE.run(thunk));
    }

    @Test
    void collapseKeepsScopedThunks() {
        Node binding = new Apply(fn(params(), m("y", i(1)), v("y")), Collections.emptyList());
        assertSame(binding, CollapseThunkApply.INSTANCE.run(binding));
        Node opaque = new Apply(fn(params(), new Raw("y = 1")), Collections.emptyList());
        assertSame(opaque, CollapseThunkApply.INSTANCE.run(opaque));
        Node withArgs = new Apply(fn(params("a"), v("a")), Collections.singletonList(i(1)));
        assertSame(withArgs, CollapseThunkApply.INSTANCE.run(withArgs));
    }

    @Test
    void dropNilElse() {
        assertEquals(new If(v("c"), v("t"), null), DropNilElse.INSTANCE.run(new If(v("c"), v("t"), new Nil())));
        assertEquals(new Unless(v("c"), v("t"), null), DropNilElse.INSTANCE.run(new Unless(v("c"), v("t"), block(new Nil()))));
        Node noElse = new If(v("c"), v("t"), null);
        assertSame(noElse, DropNilElse.INSTANCE.run(noElse));
    }

    @Test
    void ifChainBecomesCond() {
        Node chain = new If(v("a"), v("x"), new If(v("b"), v("y"), v("z")));
        Node expected = new Cond(Arrays.asList(
                new CondClause(v("a"), v("x")),
                new CondClause(v("b"), v("y")),
                new CondClause(new Bool(true), v("z"))
        ));
        assertEquals(expected, IfChainToCond.INSTANCE.run(chain));
    }

    @Test
    void longIfChainExtendsCond() {
        Node chain = new If(v("a"), v("x"), new If(v("b"), v("y"), new If(v("c"), v("w"), null)));
        Node expected = new Cond(Arrays.asList(
                new CondClause(v("a"), v("x")),
                new CondClause(v("b"), v("y")),
                new CondClause(v("c"), v("w")),
                new CondClause(new Bool(true), new Nil())
        ));
        assertEquals(expected, IfChainToCond.INSTANCE.run(chain));
    }

    @Test
    void plainIfStays() {
        Node plain = new If(v("a"), v("x"), v("y"));
        assertSame(plain, IfChainToCond.INSTANCE.run(plain));
    }
}
