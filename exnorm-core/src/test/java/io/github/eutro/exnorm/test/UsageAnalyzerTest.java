package io.github.eutro.exnorm.test;

import io.github.eutro.exnorm.analysis.UsageAnalyzer;
import io.github.eutro.exnorm.analysis.UsageIndex;
import io.github.eutro.exnorm.ast.*;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestFactory;

import java.util.*;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static io.github.eutro.exnorm.test.Trees.*;
import static org.junit.jupiter.api.Assertions.*;

public class UsageAnalyzerTest {
    private static List<Node> sample() {
        return Arrays.asList(
                m("x", i(1)),
                m("y", new If(op(">", v("x"), i(0)), v("a"), v("b"))),
                new Raw("foo(z)"),
                caseOf(v("w"), new Clause(ptuple(plit("ok"), pv("q")), op(">", v("q"), v("r")), v("s")))
        );
    }

    @Test
    void readsInNestedConditionals() {
        List<Node> stmts = sample();
        assertTrue(UsageAnalyzer.isReferenced(stmts, 0, "x"));
        assertFalse(UsageAnalyzer.isReferenced(stmts, 2, "x"));
        assertTrue(UsageAnalyzer.isReferenced(stmts, 0, "a"));
        assertTrue(UsageAnalyzer.isReferenced(stmts, 1, "b"));
        assertFalse(UsageAnalyzer.isReferencedBetween(stmts, 0, 1, "a"));
        assertTrue(UsageAnalyzer.isReferencedBetween(stmts, 0, 2, "a"));
        assertFalse(UsageAnalyzer.isReferenced(stmts, stmts.size(), "x"));
    }

    @Test
    void readsInClausesAndOpaqueText() {
        List<Node> stmts = sample();
        assertTrue(UsageAnalyzer.isReferenced(stmts, 2, "z"));
        assertFalse(UsageAnalyzer.isReferenced(stmts, 3, "z"));
        assertFalse(UsageAnalyzer.isReferenced(stmts, 0, "foo_z"));
        for (String name : Arrays.asList("q", "r", "s", "w")) {
            assertTrue(UsageAnalyzer.isReferenced(stmts, 3, name), name);
        }
        assertTrue(UsageAnalyzer.occursInOpaque(new Block(stmts), "z"));
        assertFalse(UsageAnalyzer.occursInOpaque(new Block(stmts), "x"));
    }

    @Test
    void bindersAreNotReads() {
        List<Node> stmts = Arrays.asList(
                m("unused", i(1)),
                m(ptuple(new PPin("k"), pv("val")), v("t")),
                caseOf(v("t"), clause(new PAlias("whole", ptuple(pv("inner"))), atom("ok")))
        );
        assertFalse(UsageAnalyzer.isReferenced(stmts, 0, "unused"));
        assertFalse(UsageAnalyzer.isReferenced(stmts, 0, "val"));
        assertFalse(UsageAnalyzer.isReferenced(stmts, 0, "whole"));
        assertFalse(UsageAnalyzer.isReferenced(stmts, 0, "inner"));
        assertTrue(UsageAnalyzer.isReferenced(stmts, 0, "k"));
    }

    @Test
    void segmentSizesAreReads() {
        Segment head = new Segment(pv("head"), "binary-size(len)");
        Node stmt = m(new PBinary(Collections.singletonList(head)), v("data"));
        assertTrue(UsageAnalyzer.isReferencedIn(stmt, "len"));
        assertTrue(UsageAnalyzer.isReferencedIn(stmt, "data"));
        assertFalse(UsageAnalyzer.isReferencedIn(stmt, "head"));
        assertTrue(UsageAnalyzer.occursInOpaque(stmt, "len"));
    }

    @Test
    void templatesReadAssigns() {
        Node template = new Template("H", "<p><%= @name %></p>");
        assertTrue(UsageAnalyzer.isReferencedIn(template, "assigns"));
        assertTrue(UsageAnalyzer.isReferencedIn(template, "name"));
        assertFalse(UsageAnalyzer.isReferencedIn(template, "foo"));
        assertFalse(UsageAnalyzer.isReferencedIn(new Template("H", "<p>static</p>"), "assigns"));
    }

    @Test
    void comprehensionsAndFunctions() {
        Node comprehension = new For(
                Collections.singletonList(new Generator(pv("e"), v("list"))),
                Collections.singletonList(op(">", v("e"), v("lim"))),
                null,
                call("f", v("e"))
        );
        assertTrue(UsageAnalyzer.isReferencedIn(comprehension, "lim"));
        assertTrue(UsageAnalyzer.isReferencedIn(comprehension, "list"));
        assertTrue(UsageAnalyzer.isReferencedIn(fn(params("x"), v("captured")), "captured"));
        assertTrue(UsageAnalyzer.isReferencedIn(new Interpolation(Arrays.asList(new Str("n="), v("n"))), "n"));
    }

    @Test
    void countsReads() {
        assertEquals(2, UsageAnalyzer.countReads(op("+", v("x"), v("x")), "x"));
        assertEquals(1, UsageAnalyzer.countReads(new Raw("x + x"), "x"));
        assertEquals(0, UsageAnalyzer.countReads(m("x", i(1)), "x"));
    }

    @Test
    void negativeStart() {
        assertThrows(IndexOutOfBoundsException.class, () -> UsageAnalyzer.isReferenced(sample(), -1, "x"));
        assertThrows(IndexOutOfBoundsException.class, () -> UsageIndex.of(sample()).isReferenced(-1, "x"));
    }

    @TestFactory
    Stream<DynamicTest> indexAgreesWithWalk() {
        Trees.Gen gen = new Trees.Gen(0x5eed);
        return IntStream.range(0, 100).mapToObj(n -> {
            List<Node> stmts = gen.statements();
            return DynamicTest.dynamicTest("statements " + n, () -> {
                UsageIndex index = UsageIndex.of(stmts);
                for (int from = 0; from <= stmts.size(); from++) {
                    for (String name : Trees.Gen.NAMES) {
                        assertEquals(
                                UsageAnalyzer.isReferenced(stmts, from, name),
                                index.isReferenced(from, name),
                                () -> name + " in " + new Block(stmts)
                        );
                    }
                }
            });
        });
    }
}
