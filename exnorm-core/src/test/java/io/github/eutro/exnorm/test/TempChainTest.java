package io.github.eutro.exnorm.test;

import io.github.eutro.exnorm.ast.*;
import io.github.eutro.exnorm.conf.NormalizerConfig;
import io.github.eutro.exnorm.ext.CommonExts;
import io.github.eutro.exnorm.ext.Meta;
import io.github.eutro.exnorm.passes.chain.InlineTempReturn;
import io.github.eutro.exnorm.passes.chain.TempChainCollapse;
import org.junit.jupiter.api.Test;

import static io.github.eutro.exnorm.test.Trees.*;
import static org.junit.jupiter.api.Assertions.*;

public class TempChainTest {
    private static final TempChainCollapse COLLAPSE = new TempChainCollapse(NormalizerConfig.DEFAULT);
    private static final InlineTempReturn INLINE = new InlineTempReturn(NormalizerConfig.DEFAULT);

    @Test
    void collapseFlaggedTemp() {
        Node tree = block(temp("x", v("a")), m("y", v("x")), call("use", v("y")));
        assertEquals(block(m("y", v("a")), call("use", v("y"))), COLLAPSE.run(tree));
    }

    @Test
    void collapseConventionalTemp() {
        Node tree = block(m("tmp_1", call("f")), m("result", v("tmp_1")), v("result"));
        assertEquals(block(m("result", call("f")), v("result")), COLLAPSE.run(tree));
    }

    @Test
    void collapseChainOfTemps() {
        Node tree = block(m("_g1", call("f")), m("tmp", v("_g1")), m("out", v("tmp")), v("out"));
        assertEquals(block(m("out", call("f")), v("out")), COLLAPSE.run(tree));
    }

    @Test
    void flagOverridesConvention() {
        Match user = new Match(pv("tmp"), call("f"), Meta.of(CommonExts.COMPILER_TEMP, false));
        Node tree = block(user, m("y", v("tmp")), v("y"));
        assertSame(tree, COLLAPSE.run(tree));
    }

    @Test
    void keepTempReadElsewhere() {
        Node tree = block(m("tmp", call("f")), m("y", v("tmp")), call("g", v("tmp")));
        assertSame(tree, COLLAPSE.run(tree));
        Node pinned = block(m("tmp", call("f")), m(ptuple(new PPin("tmp"), pv("y")), v("tmp")), v("y"));
        assertSame(pinned, COLLAPSE.run(pinned));
    }

    @Test
    void collapseNestedTemp() {
        Node tree = block(m(pv("y"), m("tmp", call("f"))), v("y"));
        assertEquals(block(m("y", call("f")), v("y")), COLLAPSE.run(tree));
        Node read = block(m(pv("y"), m("tmp", call("f"))), call("g", v("tmp")));
        assertSame(read, COLLAPSE.run(read));
    }

    @Test
    void nestedCollapseCompletesEarlierPair() {
        Node tree = def("f", params(),
                m("tmp_a", call("g")),
                m(pv("dst"), m("tmp_b", v("tmp_a"))),
                call("h", v("dst")));
        Node once = COLLAPSE.run(tree);
        assertEquals(def("f", params(), m("dst", call("g")), call("h", v("dst"))), once);
        assertSame(once, COLLAPSE.run(once));
    }

    @Test
    void collapseUnblocksReusedTemp() {
        Node tree = block(
                m("tmp", v("a")), m("y", v("tmp")),
                m("tmp", v("b")), m("z", v("tmp")),
                call("g", v("y"), v("z")));
        Node once = COLLAPSE.run(tree);
        assertEquals(block(m("y", v("a")), m("z", v("b")), call("g", v("y"), v("z"))), once);
        assertSame(once, COLLAPSE.run(once));
    }

    @Test
    void configuredPrefixes() {
        Node tree = block(m("__t5", call("f")), m("y", v("__t5")), v("y"));
        assertSame(tree, COLLAPSE.run(tree));
        TempChainCollapse configured = new TempChainCollapse(NormalizerConfig.builder().addTempPrefix("__t").build());
        assertEquals(block(m("y", call("f")), v("y")), configured.run(tree));
    }

    @Test
    void inlineTempReturn() {
        Node tree = def("f", params(), call("log"), m("tmp", call("f")), v("tmp"));
        assertEquals(def("f", params(), call("log"), call("f")), INLINE.run(tree));
        Node flagged = def("f", params(), temp("result", call("f")), v("result"));
        assertEquals(new Def(Def.Kind.DEF, "f", params(), null, block(call("f"))), INLINE.run(flagged));
    }

    @Test
    void inlineTempReturnChain() {
        Node tree = def("f", params(), m("tmp_a", call("f")), m("tmp_b", v("tmp_a")), v("tmp_b"));
        Node once = INLINE.run(tree);
        assertEquals(new Def(Def.Kind.DEF, "f", params(), null, block(call("f"))), once);
        assertSame(once, INLINE.run(once));
    }

    @Test
    void keepUserReturn() {
        Node tree = def("f", params(), m("result", call("f")), v("result"));
        assertSame(tree, INLINE.run(tree));
    }
}
