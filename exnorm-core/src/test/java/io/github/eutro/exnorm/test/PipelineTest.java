package io.github.eutro.exnorm.test;

import io.github.eutro.exnorm.ast.*;
import io.github.eutro.exnorm.conf.NormalizerConfig;
import io.github.eutro.exnorm.ext.CommonExts;
import io.github.eutro.exnorm.ext.Meta;
import io.github.eutro.exnorm.passes.Pipeline;
import io.github.eutro.exnorm.passes.TreePass;
import io.github.eutro.exnorm.passes.shape.FlattenBlocks;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static io.github.eutro.exnorm.test.Trees.*;
import static org.junit.jupiter.api.Assertions.*;

public class PipelineTest {
    private static final Pipeline PIPELINE = Pipeline.of(NormalizerConfig.DEFAULT);

    static Node blockAssignment() {
        return m("a", block(m("b", call("compute")), new If(v("cond"), v("t"), v("b"))));
    }

    static Node suffixedParameter() {
        return def("f", params("g2"), op("+", v("g2"), i(1)));
    }

    static Node tempCopy() {
        return block(temp("x", v("a")), m("y", v("x")));
    }

    static Node appendReducer() {
        return rcall("Enum", "reduce", v("items"), list(), fn(params("x", "acc"),
                m("list", v("acc")),
                m("list", op("++", v("list"), list(op("*", v("x"), i(2))))),
                v("list")));
    }

    static Node nestedCase() {
        PMap idMap = new PMap(Collections.singletonList(PEntry.atom("id", pv("id"))));
        return caseOf(v("r"),
                clause(ptuple(plit("ok"), pv("v")), caseOf(v("v"),
                        clause(idMap, v("id")),
                        clause(pv("other"), v("other")))),
                clause(ptuple(plit("error"), pv("e")), v("e")));
    }

    static Node unusedBinders() {
        return def("handle", params("msg", "state"),
                m(ptuple(pv("a"), pv("b")), call("split", v("state"))),
                call("reply", v("a")));
    }

    static Node nestedTempCopy() {
        return def("f", params(),
                m("tmp_a", call("g")),
                m(pv("dst"), m("tmp_b", v("tmp_a"))),
                call("h", v("dst")));
    }

    static Node ifChain() {
        return new If(v("a"), i(1), new If(v("b"), i(2), new Nil()));
    }

    static List<Node> corpus() {
        return Arrays.asList(
                blockAssignment(),
                suffixedParameter(),
                tempCopy(),
                appendReducer(),
                nestedCase(),
                unusedBinders(),
                ifChain(),
                nestedTempCopy()
        );
    }

    @Test
    void hoistsBlockOutOfAssignment() {
        Node expected = block(m("b", call("compute")), m("a", new If(v("cond"), v("t"), v("b"))));
        assertEquals(expected, PIPELINE.run(blockAssignment()));
    }

    @Test
    void stripsSuffixFromParameter() {
        assertEquals(def("f", params("g"), op("+", v("g"), i(1))), PIPELINE.run(suffixedParameter()));
    }

    @Test
    void collapsesTempCopy() {
        assertEquals(m("y", v("a")), PIPELINE.run(tempCopy()));
        Node inDef = def("f", params("a"), temp("x", v("a")), m("y", v("x")), call("g", v("y")));
        assertEquals(def("f", params("a"), m("y", v("a")), call("g", v("y"))), PIPELINE.run(inDef));
    }

    @Test
    void cleansUpBinders() {
        Node expected = def("handle", Arrays.asList(pv("_msg"), pv("state")),
                m(ptuple(pv("a"), pv("_b")), call("split", v("state"))),
                call("reply", v("a")));
        assertEquals(expected, PIPELINE.run(unusedBinders()));
    }

    @Test
    void repairsPrinterShapes() {
        Node expected = new Cond(Arrays.asList(
                new CondClause(v("a"), i(1)),
                new CondClause(v("b"), i(2)),
                new CondClause(new Bool(true), new Nil())
        ));
        assertEquals(expected, PIPELINE.run(ifChain()));
    }

    @Test
    void passOrder() {
        List<String> names = new ArrayList<>();
        for (TreePass pass : PIPELINE.passes()) {
            names.add(pass.name());
        }
        assertEquals(Arrays.asList(
                "FlattenBlocks",
                "HoistBlockAssignment",
                "CollapseThunkApply",
                "FlattenBlocks",
                "TempChainCollapse",
                "InlineTempReturn",
                "RemoveNilInit",
                "EliminateSelfAssign",
                "AccumulatorAliasUnification",
                "ElementCopyElimination",
                "FlattenNestedCase",
                "RestoreLoopNames",
                "PromoteDiscardedBinders",
                "NumericSuffixRename",
                "DeadStoreDiscard",
                "DropPureStatements",
                "MarkUnusedBinders",
                "ParameterDiscard",
                "DropNilElse",
                "IfChainToCond",
                "QualifyAppModules",
                "FlattenBlocks"
        ), names);
    }

    @Test
    void listenerSeesEveryPass() {
        List<String> changed = new ArrayList<>();
        int[] calls = {0};
        PIPELINE.run(blockAssignment(), (index, pass, before, after) -> {
            assertEquals(calls[0]++, index);
            assertSame(PIPELINE.passes().get(index), pass);
            if (before != after) changed.add(pass.name());
        });
        assertEquals(PIPELINE.passes().size(), calls[0]);
        assertEquals(Arrays.asList("HoistBlockAssignment"), changed);
    }

    @Test
    void keepsMetadataOfUntouchedNodes() {
        Meta meta = Meta.of(CommonExts.SOURCE_FILE, "lib/app.ex");
        Node tree = new Def(Def.Kind.DEF, "f", params("x"), null, call("g", v("x")), meta);
        assertSame(tree, PIPELINE.run(tree));
    }

    @Test
    void failuresNamePass() {
        TreePass failing = root -> {
            throw new IllegalStateException("boom");
        };
        Pipeline pipeline = new Pipeline(Arrays.asList(FlattenBlocks.INSTANCE, failing));
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> pipeline.run(v("x")));
        assertEquals(1, e.getSuppressed().length);
        assertTrue(e.getSuppressed()[0].getMessage().endsWith("(1) in pipeline"), e.getSuppressed()[0].getMessage());
    }

    @TestFactory
    Stream<DynamicTest> stableAfterOneRun() {
        return corpus().stream().map(tree -> DynamicTest.dynamicTest(tree.toString(), () -> {
            Node once = PIPELINE.run(tree);
            assertEquals(once, PIPELINE.run(once));
        }));
    }

    @Test
    void collapsesNestedTempChain() {
        assertEquals(def("f", params(), m("dst", call("g")), call("h", v("dst"))), PIPELINE.run(nestedTempCopy()));
    }

    @TestFactory
    Stream<DynamicTest> passesAreIdempotent() {
        return PIPELINE.passes().stream().flatMap(pass -> corpus().stream().map(tree ->
                DynamicTest.dynamicTest(pass.name() + " on " + tree, () -> {
                    Node once = pass.run(tree);
                    assertEquals(once, pass.run(once));
                })));
    }

    @TestFactory
    Stream<DynamicTest> passesAreIdempotentOnGenerated() {
        Trees.Gen gen = new Trees.Gen(0x1de4L);
        return IntStream.range(0, 150).mapToObj(n -> {
            Node tree = def("f", params(), new Block(n % 2 == 0 ? gen.statements() : gen.tempStatements()));
            return DynamicTest.dynamicTest("statements " + n, () -> {
                for (TreePass pass : PIPELINE.passes()) {
                    Node once = pass.run(tree);
                    assertEquals(once, pass.run(once), () -> pass.name() + " on " + tree);
                }
            });
        });
    }
}
