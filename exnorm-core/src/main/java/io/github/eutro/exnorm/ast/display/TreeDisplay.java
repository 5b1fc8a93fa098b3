package io.github.eutro.exnorm.ast.display;

import io.github.eutro.exnorm.ast.*;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Renders trees as Elixir-like text, for logs, debugging and tests.
 * <p>
 * Statements of a body go on separate lines; a block in expression position is
 * rendered as {@code (a; b)}. No parentheses are inserted for precedence, the tree
 * already holds {@link Paren} where they are needed.
 */
public final class TreeDisplay implements NodeVisitor<Void>, PatternVisitor<Void> {
    private static final Pattern SIMPLE_ATOM = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*[?!]?");
    private static final Pattern WORD_OP = Pattern.compile("[a-z]+");

    private final StringBuilder sb = new StringBuilder();
    private int indent;

    private TreeDisplay() {
    }

    public static String display(Node node) {
        TreeDisplay display = new TreeDisplay();
        display.body(node);
        return display.sb.toString();
    }

    public static String display(io.github.eutro.exnorm.ast.Pattern pattern) {
        TreeDisplay display = new TreeDisplay();
        pattern.accept(display);
        return display.sb.toString();
    }

    public static void debugDisplayToFile(Node node, String file) {
        File jFile = new File(file);
        File parent = jFile.getParentFile();
        if (parent != null && !parent.isDirectory() && !parent.mkdirs()) {
            throw new UncheckedIOException(new IOException("could not create " + parent));
        }
        try (FileWriter writer = new FileWriter(jFile, StandardCharsets.UTF_8)) {
            writer.write(display(node));
            writer.write('\n');
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void newline() {
        sb.append('\n');
        for (int i = 0; i < indent; i++) {
            sb.append("  ");
        }
    }

    private void body(Node node) {
        List<Node> statements = Nodes.statements(node);
        for (int i = 0; i < statements.size(); i++) {
            if (i > 0) newline();
            expr(statements.get(i));
        }
    }

    private void indented(Node body) {
        indent++;
        newline();
        body(body);
        indent--;
        newline();
    }

    private void expr(Node node) {
        node.accept(this);
    }

    private void pattern(io.github.eutro.exnorm.ast.Pattern pattern) {
        pattern.accept(this);
    }

    private <T> void join(List<T> items, String sep, Consumer<T> each) {
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) sb.append(sep);
            each.accept(items.get(i));
        }
    }

    private void args(List<Node> args) {
        sb.append('(');
        join(args, ", ", this::expr);
        sb.append(')');
    }

    private void entries(List<Entry> entries) {
        join(entries, ", ", entry -> {
            if (entry.key instanceof Atom && SIMPLE_ATOM.matcher(((Atom) entry.key).value).matches()) {
                sb.append(((Atom) entry.key).value).append(": ");
            } else {
                expr(entry.key);
                sb.append(" => ");
            }
            expr(entry.value);
        });
    }

    private void clauses(List<Clause> clauses) {
        indent++;
        for (Clause clause : clauses) {
            newline();
            pattern(clause.pattern);
            guard(clause.guard);
            sb.append(" ->");
            indent++;
            newline();
            body(clause.body);
            indent--;
        }
        indent--;
        newline();
    }

    private void guard(Node guard) {
        if (guard != null) {
            sb.append(" when ");
            expr(guard);
        }
    }

    private void conditional(String keyword, Node condition, Node then, Node otherwise) {
        sb.append(keyword).append(' ');
        expr(condition);
        sb.append(" do");
        indented(then);
        if (otherwise != null) {
            sb.append("else");
            indented(otherwise);
        }
        sb.append("end");
    }

    private void string(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '"':
                    sb.append("\\\"");
                    break;
                case '\\':
                    sb.append("\\\\");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '#':
                    sb.append(i + 1 < text.length() && text.charAt(i + 1) == '{' ? "\\#" : "#");
                    break;
                default:
                    sb.append(c);
            }
        }
    }

    @Override
    public Void visitNil(Nil node) {
        sb.append("nil");
        return null;
    }

    @Override
    public Void visitBool(Bool node) {
        sb.append(node.value);
        return null;
    }

    @Override
    public Void visitIntLit(IntLit node) {
        sb.append(node.value);
        return null;
    }

    @Override
    public Void visitFloatLit(FloatLit node) {
        sb.append(node.value);
        return null;
    }

    @Override
    public Void visitStr(Str node) {
        sb.append('"');
        string(node.value);
        sb.append('"');
        return null;
    }

    @Override
    public Void visitAtom(Atom node) {
        if (SIMPLE_ATOM.matcher(node.value).matches()) {
            sb.append(':').append(node.value);
        } else {
            sb.append(":\"");
            string(node.value);
            sb.append('"');
        }
        return null;
    }

    @Override
    public Void visitVar(Var node) {
        sb.append(node.name);
        return null;
    }

    @Override
    public Void visitModuleRef(ModuleRef node) {
        sb.append(node.name);
        return null;
    }

    @Override
    public Void visitAttribute(Attribute node) {
        sb.append('@').append(node.name);
        if (node.value != null) {
            sb.append(' ');
            expr(node.value);
        }
        return null;
    }

    @Override
    public Void visitMatch(Match node) {
        pattern(node.pattern);
        sb.append(" = ");
        expr(node.value);
        return null;
    }

    @Override
    public Void visitBlock(Block node) {
        sb.append('(');
        join(node.statements, "; ", this::expr);
        sb.append(')');
        return null;
    }

    @Override
    public Void visitParen(Paren node) {
        sb.append('(');
        expr(node.inner);
        sb.append(')');
        return null;
    }

    @Override
    public Void visitIf(If node) {
        conditional("if", node.condition, node.then, node.otherwise);
        return null;
    }

    @Override
    public Void visitUnless(Unless node) {
        conditional("unless", node.condition, node.then, node.otherwise);
        return null;
    }

    @Override
    public Void visitCond(Cond node) {
        sb.append("cond do");
        indent++;
        for (CondClause clause : node.clauses) {
            newline();
            expr(clause.condition);
            sb.append(" ->");
            indent++;
            newline();
            body(clause.body);
            indent--;
        }
        indent--;
        newline();
        sb.append("end");
        return null;
    }

    @Override
    public Void visitCase(Case node) {
        sb.append("case ");
        expr(node.subject);
        sb.append(" do");
        clauses(node.clauses);
        sb.append("end");
        return null;
    }

    @Override
    public Void visitWith(With node) {
        sb.append("with ");
        join(node.steps, ", ", step -> {
            if (step.pattern != null) {
                pattern(step.pattern);
                sb.append(" <- ");
            }
            expr(step.expr);
        });
        sb.append(" do");
        indented(node.body);
        if (!node.elseClauses.isEmpty()) {
            sb.append("else");
            clauses(node.elseClauses);
        }
        sb.append("end");
        return null;
    }

    @Override
    public Void visitReceive(Receive node) {
        sb.append("receive do");
        clauses(node.clauses);
        if (node.afterTimeout != null) {
            sb.append("after");
            indent++;
            newline();
            expr(node.afterTimeout);
            sb.append(" ->");
            if (node.afterBody != null) {
                indent++;
                newline();
                body(node.afterBody);
                indent--;
            }
            indent--;
            newline();
        }
        sb.append("end");
        return null;
    }

    @Override
    public Void visitFn(Fn node) {
        if (node.clauses.size() == 1 && !(node.clauses.get(0).body instanceof Block)) {
            FnClause clause = node.clauses.get(0);
            sb.append("fn ");
            join(clause.params, ", ", this::pattern);
            guard(clause.guard);
            sb.append(clause.params.isEmpty() && clause.guard == null ? "-> " : " -> ");
            expr(clause.body);
            sb.append(" end");
            return null;
        }
        sb.append("fn");
        indent++;
        for (FnClause clause : node.clauses) {
            newline();
            join(clause.params, ", ", this::pattern);
            guard(clause.guard);
            sb.append(clause.params.isEmpty() && clause.guard == null ? "->" : " ->");
            indent++;
            newline();
            body(clause.body);
            indent--;
        }
        indent--;
        newline();
        sb.append("end");
        return null;
    }

    @Override
    public Void visitDef(Def node) {
        sb.append(node.kind.keyword).append(' ').append(node.name).append('(');
        join(node.params, ", ", this::pattern);
        sb.append(')');
        guard(node.guard);
        sb.append(" do");
        indented(node.body);
        sb.append("end");
        return null;
    }

    @Override
    public Void visitCapture(Capture node) {
        if (node.arity < 0) {
            sb.append("&(");
            expr(node.target);
            sb.append(')');
        } else {
            sb.append('&');
            expr(node.target);
            sb.append('/').append(node.arity);
        }
        return null;
    }

    @Override
    public Void visitCall(Call node) {
        sb.append(node.name);
        args(node.args);
        return null;
    }

    @Override
    public Void visitRemoteCall(RemoteCall node) {
        expr(node.module);
        sb.append('.').append(node.function);
        args(node.args);
        return null;
    }

    @Override
    public Void visitApply(Apply node) {
        expr(node.function);
        sb.append('.');
        args(node.args);
        return null;
    }

    @Override
    public Void visitBinOp(BinOp node) {
        expr(node.left);
        sb.append(' ').append(node.op).append(' ');
        expr(node.right);
        return null;
    }

    @Override
    public Void visitUnaryOp(UnaryOp node) {
        sb.append(node.op);
        if (WORD_OP.matcher(node.op).matches()) sb.append(' ');
        expr(node.operand);
        return null;
    }

    @Override
    public Void visitPipe(Pipe node) {
        expr(node.left);
        sb.append(" |> ");
        expr(node.right);
        return null;
    }

    @Override
    public Void visitTuple(Tuple node) {
        sb.append('{');
        join(node.elements, ", ", this::expr);
        sb.append('}');
        return null;
    }

    @Override
    public Void visitListLit(ListLit node) {
        sb.append('[');
        join(node.elements, ", ", this::expr);
        sb.append(']');
        return null;
    }

    @Override
    public Void visitCons(Cons node) {
        sb.append('[');
        join(node.heads, ", ", this::expr);
        sb.append(" | ");
        expr(node.tail);
        sb.append(']');
        return null;
    }

    @Override
    public Void visitMapLit(MapLit node) {
        sb.append("%{");
        entries(node.entries);
        sb.append('}');
        return null;
    }

    @Override
    public Void visitMapUpdate(MapUpdate node) {
        sb.append("%{");
        expr(node.map);
        sb.append(" | ");
        entries(node.entries);
        sb.append('}');
        return null;
    }

    @Override
    public Void visitStruct(Struct node) {
        sb.append('%').append(node.module).append('{');
        entries(node.fields);
        sb.append('}');
        return null;
    }

    @Override
    public Void visitStructUpdate(StructUpdate node) {
        sb.append('%').append(node.module).append('{');
        expr(node.target);
        sb.append(" | ");
        entries(node.fields);
        sb.append('}');
        return null;
    }

    @Override
    public Void visitKeyword(Keyword node) {
        sb.append('[');
        entries(node.pairs);
        sb.append(']');
        return null;
    }

    @Override
    public Void visitAccess(Access node) {
        expr(node.target);
        sb.append('[');
        expr(node.key);
        sb.append(']');
        return null;
    }

    @Override
    public Void visitField(Field node) {
        expr(node.target);
        sb.append('.').append(node.name);
        return null;
    }

    @Override
    public Void visitFor(For node) {
        sb.append("for ");
        join(node.generators, ", ", gen -> {
            if (gen.bitstring) sb.append("<<");
            pattern(gen.pattern);
            sb.append(" <- ");
            expr(gen.source);
            if (gen.bitstring) sb.append(">>");
        });
        for (Node filter : node.filters) {
            sb.append(", ");
            expr(filter);
        }
        if (node.into != null) {
            sb.append(", into: ");
            expr(node.into);
        }
        sb.append(" do");
        indented(node.body);
        sb.append("end");
        return null;
    }

    @Override
    public Void visitRange(Range node) {
        expr(node.first);
        sb.append("..");
        expr(node.last);
        if (node.step != null) {
            sb.append("//");
            expr(node.step);
        }
        return null;
    }

    @Override
    public Void visitTry(Try node) {
        sb.append("try do");
        indented(node.body);
        if (!node.rescueClauses.isEmpty()) {
            sb.append("rescue");
            clauses(node.rescueClauses);
        }
        if (!node.catchClauses.isEmpty()) {
            sb.append("catch");
            clauses(node.catchClauses);
        }
        if (!node.elseClauses.isEmpty()) {
            sb.append("else");
            clauses(node.elseClauses);
        }
        if (node.after != null) {
            sb.append("after");
            indented(node.after);
        }
        sb.append("end");
        return null;
    }

    @Override
    public Void visitRaise(Raise node) {
        sb.append("raise ");
        expr(node.error);
        return null;
    }

    @Override
    public Void visitThrow(Throw node) {
        sb.append("throw ");
        expr(node.value);
        return null;
    }

    @Override
    public Void visitModuleDef(ModuleDef node) {
        sb.append("defmodule ").append(node.name).append(" do");
        indented(node.body);
        sb.append("end");
        return null;
    }

    @Override
    public Void visitDirective(Directive node) {
        sb.append(node.kind.keyword).append(' ').append(node.module);
        if (node.options != null) {
            sb.append(", ");
            expr(node.options);
        }
        return null;
    }

    @Override
    public Void visitRaw(Raw node) {
        sb.append(node.code);
        return null;
    }

    @Override
    public Void visitTemplate(Template node) {
        sb.append('~').append(node.sigil).append("\"\"\"").append(node.text).append("\"\"\"");
        return null;
    }

    @Override
    public Void visitInterpolation(Interpolation node) {
        sb.append('"');
        for (Node part : node.parts) {
            if (part instanceof Str) {
                string(((Str) part).value);
            } else {
                sb.append("#{");
                expr(part);
                sb.append('}');
            }
        }
        sb.append('"');
        return null;
    }

    @Override
    public Void visitPVar(PVar pattern) {
        sb.append(pattern.name);
        return null;
    }

    @Override
    public Void visitPWildcard(PWildcard pattern) {
        sb.append('_');
        return null;
    }

    @Override
    public Void visitPLit(PLit pattern) {
        expr(pattern.literal);
        return null;
    }

    @Override
    public Void visitPTuple(PTuple pattern) {
        sb.append('{');
        join(pattern.elements, ", ", this::pattern);
        sb.append('}');
        return null;
    }

    @Override
    public Void visitPList(PList pattern) {
        sb.append('[');
        join(pattern.elements, ", ", this::pattern);
        sb.append(']');
        return null;
    }

    @Override
    public Void visitPCons(PCons pattern) {
        sb.append('[');
        join(pattern.heads, ", ", this::pattern);
        sb.append(" | ");
        pattern(pattern.tail);
        sb.append(']');
        return null;
    }

    private void patternEntries(List<PEntry> entries) {
        join(entries, ", ", entry -> {
            if (entry.key instanceof PLit
                    && ((PLit) entry.key).literal instanceof Atom
                    && SIMPLE_ATOM.matcher(((Atom) ((PLit) entry.key).literal).value).matches()) {
                sb.append(((Atom) ((PLit) entry.key).literal).value).append(": ");
            } else {
                pattern(entry.key);
                sb.append(" => ");
            }
            pattern(entry.value);
        });
    }

    @Override
    public Void visitPMap(PMap pattern) {
        sb.append("%{");
        patternEntries(pattern.entries);
        sb.append('}');
        return null;
    }

    @Override
    public Void visitPStruct(PStruct pattern) {
        sb.append('%').append(pattern.module).append('{');
        patternEntries(pattern.entries);
        sb.append('}');
        return null;
    }

    @Override
    public Void visitPPin(PPin pattern) {
        sb.append('^').append(pattern.name);
        return null;
    }

    @Override
    public Void visitPAlias(PAlias pattern) {
        pattern(pattern.pattern);
        sb.append(" = ").append(pattern.name);
        return null;
    }

    @Override
    public Void visitPBinary(PBinary pattern) {
        sb.append("<<");
        join(pattern.segments, ", ", segment -> {
            pattern(segment.value);
            if (segment.spec != null) sb.append("::").append(segment.spec);
        });
        sb.append(">>");
        return null;
    }
}
