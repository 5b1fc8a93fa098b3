package io.github.eutro.exnorm.test;

import io.github.eutro.exnorm.ast.*;
import io.github.eutro.exnorm.ast.display.TreeDisplay;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;

import static io.github.eutro.exnorm.test.Trees.*;
import static org.junit.jupiter.api.Assertions.*;

public class TreeDisplayTest {
    @Test
    void bodiesOnSeparateLines() {
        Node tree = def("f", params("a", "b"), m("c", op("+", v("a"), v("b"))), v("c"));
        assertEquals("def f(a, b) do\n  c = a + b\n  c\nend", TreeDisplay.display(tree));
        assertEquals(TreeDisplay.display(tree), tree.toString());
    }

    @Test
    void conditionalsAndClauses() {
        assertEquals("if c do\n  t\nelse\n  e\nend", TreeDisplay.display(new If(v("c"), v("t"), v("e"))));
        Node aCase = caseOf(v("r"), clause(ptuple(plit("ok"), pv("v")), v("v")));
        assertEquals("case r do\n  {:ok, v} ->\n    v\nend", TreeDisplay.display(aCase));
    }

    @Test
    void expressions() {
        assertEquals("x = (f(); 1)", TreeDisplay.display(m("x", block(call("f"), i(1)))));
        assertEquals("fn x -> x * 2 end", TreeDisplay.display(fn(params("x"), op("*", v("x"), i(2)))));
        Node map = new MapLit(Arrays.asList(new Entry(atom("a"), i(1)), new Entry(new Str("b"), i(2))));
        assertEquals("%{a: 1, \"b\" => 2}", TreeDisplay.display(map));
        assertEquals("Enum.map(xs, &f/1)",
                TreeDisplay.display(rcall("Enum", "map", v("xs"), new Capture(v("f"), 1))));
    }

    @Test
    void opaqueFragments() {
        assertEquals("~H\"\"\"<p>@x</p>\"\"\"", TreeDisplay.display(new Template("H", "<p>@x</p>")));
        assertEquals("\"n=#{n}\"", TreeDisplay.display(new Interpolation(Arrays.asList(new Str("n="), v("n")))));
        assertEquals("IO.inspect(x)", TreeDisplay.display(new Raw("IO.inspect(x)")));
    }

    @Test
    void patterns() {
        PMap idMap = new PMap(Collections.singletonList(PEntry.atom("id", pv("id"))));
        assertEquals("%{id: id} = m", new PAlias("m", idMap).toString());
        PBinary binary = new PBinary(Arrays.asList(
                new Segment(pv("h"), "binary-size(2)"),
                new Segment(pv("rest"), "binary")));
        assertEquals("<<h::binary-size(2), rest::binary>>", TreeDisplay.display(binary));
        assertEquals("{^x, _}", TreeDisplay.display(ptuple(new PPin("x"), new PWildcard())));
    }

    @Test
    void debugDisplayToFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("trees").resolve("f.ex");
        TreeDisplay.debugDisplayToFile(def("f", params(), atom("ok")), file.toString());
        assertEquals("def f() do\n  :ok\nend\n", new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
    }

    @Test
    void debugDisplayWritesUtf8(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("greet.ex");
        TreeDisplay.debugDisplayToFile(def("greet", params(), new Str("h\u00e9llo \u2713")), file.toString());
        assertEquals("def greet() do\n  \"h\u00e9llo \u2713\"\nend\n",
                new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
    }
}
