package io.github.eutro.exnorm.test;

import io.github.eutro.exnorm.ast.*;
import io.github.eutro.exnorm.conf.NormalizerConfig;
import io.github.eutro.exnorm.ext.CommonExts;
import io.github.eutro.exnorm.ext.Meta;
import io.github.eutro.exnorm.ext.NodeRole;
import io.github.eutro.exnorm.passes.hygiene.*;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static io.github.eutro.exnorm.test.Trees.*;
import static org.junit.jupiter.api.Assertions.*;

public class HygienePassesTest {
    private static final NumericSuffixRename SUFFIXES = new NumericSuffixRename(NormalizerConfig.DEFAULT);

    @Test
    void promoteDiscardedBinderThatIsRead() {
        Node tree = def("f", params(), m("_result", call("compute")), call("log", v("result")));
        Node expected = def("f", params(), m("result", call("compute")), call("log", v("result")));
        assertEquals(expected, PromoteDiscardedBinders.INSTANCE.run(tree));
    }

    @Test
    void promoteOnlyWhenUnambiguous() {
        Node boundElsewhere = def("f", params("result"), m("_result", call("compute")), call("log", v("result")));
        assertSame(boundElsewhere, PromoteDiscardedBinders.INSTANCE.run(boundElsewhere));
        Node alsoRead = def("f", params(), m("_result", call("compute")), call("log", v("result"), v("_result")));
        assertSame(alsoRead, PromoteDiscardedBinders.INSTANCE.run(alsoRead));
        Node doubleUnderscore = def("f", params(), m("__x", call("compute")), call("log", v("_x")));
        assertSame(doubleUnderscore, PromoteDiscardedBinders.INSTANCE.run(doubleUnderscore));
    }

    @Test
    void promoteInClause() {
        Node tree = caseOf(v("r"), clause(ptuple(plit("ok"), pv("_val")), call("use", v("val"))));
        Node expected = caseOf(v("r"), clause(ptuple(plit("ok"), pv("val")), call("use", v("val"))));
        assertEquals(expected, PromoteDiscardedBinders.INSTANCE.run(tree));
    }

    @Test
    void markUnusedClauseBinders() {
        Node tree = caseOf(v("r"),
                clause(ptuple(plit("ok"), pv("val")), atom("done")),
                clause(ptuple(plit("error"), pv("reason")), call("log", v("reason"))));
        Node expected = caseOf(v("r"),
                clause(ptuple(plit("ok"), pv("_val")), atom("done")),
                clause(ptuple(plit("error"), pv("reason")), call("log", v("reason"))));
        assertEquals(expected, MarkUnusedBinders.INSTANCE.run(tree));
    }

    @Test
    void markSkipsRepeatsClashesAndTemplates() {
        Node repeated = caseOf(v("r"), clause(ptuple(pv("x"), pv("x")), atom("same")));
        assertSame(repeated, MarkUnusedBinders.INSTANCE.run(repeated));
        Node clash = caseOf(v("r"), clause(ptuple(pv("val"), pv("_val")), atom("ok")));
        assertSame(clash, MarkUnusedBinders.INSTANCE.run(clash));
        Node template = caseOf(v("r"), clause(pv("assigns"), new Template("H", "<p>@name</p>")));
        assertSame(template, MarkUnusedBinders.INSTANCE.run(template));
    }

    @Test
    void markDestructuringMatches() {
        Node tree = def("f", params(), m(ptuple(pv("a"), pv("b")), call("split")), v("a"));
        Node expected = def("f", params(), m(ptuple(pv("a"), pv("_b")), call("split")), v("a"));
        assertEquals(expected, MarkUnusedBinders.INSTANCE.run(tree));
        Node plain = def("f", params(), m("x", call("g")), atom("ok"));
        assertSame(plain, MarkUnusedBinders.INSTANCE.run(plain));
    }

    @Test
    void markWithStepsAndElse() {
        Node tree = new With(
                Arrays.asList(
                        new WithStep(ptuple(plit("ok"), pv("user")), call("fetch")),
                        new WithStep(ptuple(plit("ok"), pv("token")), call("sign", v("user")))),
                atom("ok"),
                Collections.singletonList(clause(ptuple(plit("error"), pv("why")), atom("failed"))));
        Node expected = new With(
                Arrays.asList(
                        new WithStep(ptuple(plit("ok"), pv("user")), call("fetch")),
                        new WithStep(ptuple(plit("ok"), pv("_token")), call("sign", v("user")))),
                atom("ok"),
                Collections.singletonList(clause(ptuple(plit("error"), pv("_why")), atom("failed"))));
        assertEquals(expected, MarkUnusedBinders.INSTANCE.run(tree));
    }

    @Test
    void markGeneratorsAndRescues() {
        Node comprehension = new For(
                Collections.singletonList(new Generator(ptuple(pv("k"), pv("val")), v("map"))),
                Collections.emptyList(), null, v("k"));
        Node expected = new For(
                Collections.singletonList(new Generator(ptuple(pv("k"), pv("_val")), v("map"))),
                Collections.emptyList(), null, v("k"));
        assertEquals(expected, MarkUnusedBinders.INSTANCE.run(comprehension));

        Node rescue = new Try(call("risky"),
                Collections.singletonList(clause(pv("e"), atom("error"))),
                Collections.emptyList(), Collections.emptyList(), null);
        Node rescued = new Try(call("risky"),
                Collections.singletonList(clause(pv("_e"), atom("error"))),
                Collections.emptyList(), Collections.emptyList(), null);
        assertEquals(rescued, MarkUnusedBinders.INSTANCE.run(rescue));
    }

    @Test
    void discardUnreadParameters() {
        assertEquals(def("f", Arrays.asList(pv("a"), pv("_b")), v("a")),
                ParameterDiscard.INSTANCE.run(def("f", params("a", "b"), v("a"))));
        assertEquals(fn(Arrays.asList(pv("_x"), pv("acc")), v("acc")),
                ParameterDiscard.INSTANCE.run(fn(params("x", "acc"), v("acc"))));
    }

    @Test
    void keepReadParameters() {
        Node guarded = new Def(Def.Kind.DEF, "f", params("n"), op(">", v("n"), i(0)), atom("pos"));
        assertSame(guarded, ParameterDiscard.INSTANCE.run(guarded));
        Node raw = def("f", params("conn"), new Raw("render(conn)"));
        assertSame(raw, ParameterDiscard.INSTANCE.run(raw));
        Node template = def("render", params("assigns"), new Template("H", "<%= @title %>"));
        assertSame(template, ParameterDiscard.INSTANCE.run(template));
        Node equal = def("eq", params("x", "x"), new Bool(true));
        assertSame(equal, ParameterDiscard.INSTANCE.run(equal));
        Node clash = def("f", params("a"), new Raw("_a"));
        assertSame(clash, ParameterDiscard.INSTANCE.run(clash));
    }

    @Test
    void renderFunctionsKeepAssigns() {
        Meta render = Meta.of(CommonExts.ROLE, NodeRole.TEMPLATE_RENDER);
        Node def = new Def(Def.Kind.DEF, "render", params("assigns"), null, new Raw("render_slot(@inner_block)"), render);
        assertSame(def, ParameterDiscard.INSTANCE.run(def));
        Node fn = new Fn(Collections.singletonList(new FnClause(params("assigns", "opts"), null, call("static"))), render);
        assertEquals(new Fn(Collections.singletonList(new FnClause(params("assigns", "_opts"), null, call("static")))),
                ParameterDiscard.INSTANCE.run(fn));
        Node plain = def("render", params("assigns"), call("static"));
        assertEquals(def("render", params("_assigns"), call("static")), ParameterDiscard.INSTANCE.run(plain));
    }

    @Test
    void stripNumericSuffix() {
        Node tree = def("f", params("g2"), op("+", v("g2"), i(1)));
        assertEquals(def("f", params("g"), op("+", v("g"), i(1))), SUFFIXES.run(tree));
        assertEquals(def("f", params("item"), v("item")), SUFFIXES.run(def("f", params("item_2"), v("item_2"))));
    }

    @Test
    void suffixFallsBackToAlternatives() {
        Node tree = def("f", params("item", "item2"), call("pair", v("item"), v("item2")));
        assertEquals(def("f", params("item", "value"), call("pair", v("item"), v("value"))), SUFFIXES.run(tree));

        Node pair = def("f", params("x1", "x2"), call("g", v("x1"), v("x2")));
        assertEquals(def("f", params("x", "value"), call("g", v("x"), v("value"))), SUFFIXES.run(pair));

        NumericSuffixRename noAlternatives = new NumericSuffixRename(NormalizerConfig.builder()
                .setAlternativeNames(Collections.<String>emptyList())
                .build());
        assertSame(tree, noAlternatives.run(tree));
    }

    @Test
    void suffixLeavesOpaqueAndKeywords() {
        Node opaque = def("f", params("row1"), new Raw("row1.id"));
        assertSame(opaque, SUFFIXES.run(opaque));
        Node keyword = def("f", params("end1"), v("end1"));
        assertSame(keyword, SUFFIXES.run(keyword));
    }

    private static Meta origins(String generated, String original) {
        Map<String, String> names = new LinkedHashMap<>();
        names.put(generated, original);
        return Meta.of(CommonExts.LOOP_ORIGIN_NAMES, names);
    }

    @Test
    void restoreLoopNamesOfFunction() {
        Fn tree = new Fn(
                Collections.singletonList(fnClause(params("x1", "acc"), call("save", v("x1"), v("acc")))),
                origins("x1", "user"));
        Fn result = (Fn) RestoreLoopNames.INSTANCE.run(tree);
        assertEquals(fn(params("user", "acc"), call("save", v("user"), v("acc"))), result);
        assertFalse(result.getExt(CommonExts.LOOP_ORIGIN_NAMES).isPresent());
    }

    @Test
    void restoreLoopNamesOfComprehension() {
        For tree = new For(
                Collections.singletonList(new Generator(pv("x1"), v("users"))),
                Collections.emptyList(), null, call("notify", v("x1")),
                origins("x1", "user"));
        assertEquals(new For(
                Collections.singletonList(new Generator(pv("user"), v("users"))),
                Collections.emptyList(), null, call("notify", v("user"))), RestoreLoopNames.INSTANCE.run(tree));
    }

    @Test
    void keepLoopNamesWhenUnsafe() {
        Fn taken = new Fn(
                Collections.singletonList(fnClause(params("x1", "acc"), call("save", v("x1"), v("user")))),
                origins("x1", "user"));
        Node result = RestoreLoopNames.INSTANCE.run(taken);
        assertSame(taken, result);
        assertTrue(result.getExt(CommonExts.LOOP_ORIGIN_NAMES).isPresent());

        For outerRead = new For(
                Collections.singletonList(new Generator(pv("x1"), call("list", v("x1")))),
                Collections.emptyList(), null, v("x1"),
                origins("x1", "user"));
        assertSame(outerRead, RestoreLoopNames.INSTANCE.run(outerRead));

        Fn notBinder = new Fn(
                Collections.singletonList(fnClause(params("a"), m("y", v("a")), v("y"))),
                origins("y", "z"));
        assertSame(notBinder, RestoreLoopNames.INSTANCE.run(notBinder));
    }
}
