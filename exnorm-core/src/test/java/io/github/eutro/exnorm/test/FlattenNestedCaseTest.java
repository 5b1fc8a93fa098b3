package io.github.eutro.exnorm.test;

import io.github.eutro.exnorm.ast.*;
import io.github.eutro.exnorm.passes.dispatch.FlattenNestedCase;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static io.github.eutro.exnorm.test.Trees.*;
import static org.junit.jupiter.api.Assertions.*;

public class FlattenNestedCaseTest {
    private static PMap idMap() {
        return new PMap(Collections.singletonList(PEntry.atom("id", pv("id"))));
    }

    private static Case nested(Clause... inner) {
        return caseOf(v("r"),
                clause(ptuple(plit("ok"), pv("v")), caseOf(v("v"), inner)),
                clause(ptuple(plit("error"), pv("e")), v("e")));
    }

    @Test
    void mergesInnerClauses() {
        Case tree = nested(
                clause(idMap(), v("id")),
                clause(pv("other"), v("other")));
        Case result = (Case) FlattenNestedCase.INSTANCE.run(tree);
        assertEquals(caseOf(v("r"),
                clause(ptuple(plit("ok"), idMap()), v("id")),
                clause(ptuple(plit("ok"), pv("other")), v("other")),
                clause(ptuple(plit("error"), pv("e")), v("e"))), result);
        // M outer clauses and K inner ones give M - 1 + K
        assertEquals(2 - 1 + 2, result.clauses.size());
    }

    @Test
    void renamesReadsToInnerBinder() {
        Case tree = nested(
                clause(idMap(), v("id")),
                clause(pv("other"), call("f", v("v"))));
        Case result = (Case) FlattenNestedCase.INSTANCE.run(tree);
        assertEquals(clause(ptuple(plit("ok"), pv("other")), call("f", v("other"))), result.clauses.get(1));
    }

    @Test
    void keepsOuterBindingWhereRead() {
        Case tree = nested(
                clause(idMap(), new Tuple(Arrays.asList(v("v"), v("id")))),
                clause(new PWildcard(), call("g", v("v"))));
        Case result = (Case) FlattenNestedCase.INSTANCE.run(tree);
        assertEquals(Arrays.asList(
                clause(ptuple(plit("ok"), new PAlias("v", idMap())), new Tuple(Arrays.asList(v("v"), v("id")))),
                clause(ptuple(plit("ok"), pv("v")), call("g", v("v"))),
                clause(ptuple(plit("error"), pv("e")), v("e"))
        ), result.clauses);
    }

    @Test
    void wildcardStaysUnboundWhenUnread() {
        Case tree = nested(
                clause(idMap(), v("id")),
                clause(new PWildcard(), atom("none")));
        Case result = (Case) FlattenNestedCase.INSTANCE.run(tree);
        assertEquals(clause(ptuple(plit("ok"), new PWildcard()), atom("none")), result.clauses.get(1));
    }

    @Test
    void refusesUnsafeShapes() {
        Case refutableLast = nested(clause(idMap(), v("id")));
        assertSame(refutableLast, FlattenNestedCase.INSTANCE.run(refutableLast));

        Case guarded = caseOf(v("r"),
                new Clause(ptuple(plit("ok"), pv("v")), call("is_map", v("v")),
                        caseOf(v("v"), clause(pv("x"), v("x")))));
        assertSame(guarded, FlattenNestedCase.INSTANCE.run(guarded));

        Case pinned = nested(
                clause(ptuple(new PPin("v")), atom("same")),
                clause(new PWildcard(), atom("other")));
        assertSame(pinned, FlattenNestedCase.INSTANCE.run(pinned));

        Case otherSubject = caseOf(v("r"),
                clause(ptuple(plit("ok"), pv("v")), caseOf(v("w"), clause(pv("x"), v("x")))));
        assertSame(otherSubject, FlattenNestedCase.INSTANCE.run(otherSubject));
    }

    @Test
    void flattensRepeatedly() {
        Case tree = caseOf(v("r"),
                clause(ptuple(plit("ok"), pv("v")),
                        caseOf(v("v"),
                                clause(ptuple(plit("some"), pv("w")),
                                        caseOf(v("w"),
                                                clause(plit("a"), atom("is_a")),
                                                clause(new PWildcard(), atom("not_a")))),
                                clause(new PWildcard(), atom("none")))));
        Case result = (Case) FlattenNestedCase.INSTANCE.run(tree);
        assertEquals(caseOf(v("r"),
                clause(ptuple(plit("ok"), ptuple(plit("some"), plit("a"))), atom("is_a")),
                clause(ptuple(plit("ok"), ptuple(plit("some"), new PWildcard())), atom("not_a")),
                clause(ptuple(plit("ok"), new PWildcard()), atom("none"))), result);
        assertEquals(result, FlattenNestedCase.INSTANCE.run(result));
    }
}
