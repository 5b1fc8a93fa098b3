package io.github.eutro.exnorm.test;

import io.github.eutro.exnorm.analysis.Scopes;
import io.github.eutro.exnorm.ast.*;
import io.github.eutro.exnorm.transform.Renamer;
import io.github.eutro.exnorm.transform.Transformer;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static io.github.eutro.exnorm.test.Trees.*;
import static org.junit.jupiter.api.Assertions.*;

public class TransformerTest {
    @Test
    void untouchedTreesKeepIdentity() {
        Node tree = def("f", params("x"), m("y", call("g", v("x"))), v("y"));
        assertSame(tree, Transformer.transform(tree, node -> node));
    }

    @Test
    void visitsChildrenFirst() {
        List<String> order = new ArrayList<>();
        Node tree = call("f", v("a"), call("g", v("b")));
        Transformer.transform(tree, node -> {
            order.add(node instanceof Call ? ((Call) node).name : ((Var) node).name);
            return node;
        });
        assertEquals(Arrays.asList("a", "b", "g", "f"), order);
    }

    @Test
    void replacementsAreNotRevisited() {
        int[] visits = {0};
        Node result = Transformer.transform(call("f", v("a")), node -> {
            visits[0]++;
            return node instanceof Var ? call("h", v("z")) : node;
        });
        assertEquals(call("f", call("h", v("z"))), result);
        assertEquals(2, visits[0]);
    }

    @Test
    void contextSeesOriginalAncestors() {
        Def tree = def("f", params(), block(m("x", i(1)), v("x")));
        List<Boolean> scopes = new ArrayList<>();
        Transformer.transform(tree, (node, ctx) -> {
            if (node instanceof Block) scopes.add(Scopes.isScopeBody(ctx));
            if (node instanceof IntLit) {
                assertSame(tree, ctx.nearest(Def.class));
                assertEquals(3, ctx.ancestors().size());
                assertFalse(ctx.isRoot());
            }
            if (node instanceof Def) assertTrue(ctx.isRoot());
            return node instanceof Var ? v("renamed") : node;
        });
        assertEquals(Arrays.asList(true), scopes);
    }

    @Test
    void renamerRefusesOpaqueText() {
        Node tree = block(m("x", i(1)), call("f", v("x")));
        assertEquals(block(m("y", i(1)), call("f", v("y"))), Renamer.rename(tree, "x", "y"));
        assertNull(Renamer.rename(block(m("x", i(1)), new Raw("f(x)")), "x", "y"));
        Node pinned = m(ptuple(new PPin("x")), v("x"));
        assertEquals(m(ptuple(new PPin("y")), v("y")), Renamer.rename(pinned, "x", "y"));
    }
}
