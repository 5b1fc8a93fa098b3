package io.github.eutro.exnorm.analysis;

import io.github.eutro.exnorm.ast.*;
import io.github.eutro.exnorm.ext.CommonExts;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Decides whether evaluating an expression can have an effect, including raising.
 * <p>
 * Anything not known to be pure is impure. The front end can vouch for an expression
 * with {@link CommonExts#IS_PURE}.
 */
public final class Purity {
    // operators that never raise, whatever their operands
    private static final Set<String> PURE_OPS = new HashSet<>(Arrays.asList(
            "==", "!=", "===", "!==", "<", ">", "<=", ">=", "&&", "||"
    ));

    private Purity() {
    }

    public static boolean isPure(Node node) {
        if (node.isFlagged(CommonExts.IS_PURE)) return true;
        return node.accept(new NodeVisitor.Default<Boolean>() {
            @Override
            protected Boolean visitDefault(Node node) {
                return false;
            }

            @Override
            public Boolean visitNil(Nil node) {
                return true;
            }

            @Override
            public Boolean visitBool(Bool node) {
                return true;
            }

            @Override
            public Boolean visitIntLit(IntLit node) {
                return true;
            }

            @Override
            public Boolean visitFloatLit(FloatLit node) {
                return true;
            }

            @Override
            public Boolean visitStr(Str node) {
                return true;
            }

            @Override
            public Boolean visitAtom(Atom node) {
                return true;
            }

            @Override
            public Boolean visitVar(Var node) {
                return true;
            }

            @Override
            public Boolean visitModuleRef(ModuleRef node) {
                return true;
            }

            @Override
            public Boolean visitAttribute(Attribute node) {
                return node.value == null;
            }

            @Override
            public Boolean visitParen(Paren node) {
                return isPure(node.inner);
            }

            @Override
            public Boolean visitFn(Fn node) {
                return true;
            }

            @Override
            public Boolean visitCapture(Capture node) {
                return true;
            }

            @Override
            public Boolean visitTuple(Tuple node) {
                return allPure(node.elements);
            }

            @Override
            public Boolean visitListLit(ListLit node) {
                return allPure(node.elements);
            }

            @Override
            public Boolean visitCons(Cons node) {
                return allPure(node.heads) && isPure(node.tail);
            }

            @Override
            public Boolean visitMapLit(MapLit node) {
                return entriesPure(node.entries);
            }

            @Override
            public Boolean visitKeyword(Keyword node) {
                return entriesPure(node.pairs);
            }

            @Override
            public Boolean visitBinOp(BinOp node) {
                return PURE_OPS.contains(node.op) && isPure(node.left) && isPure(node.right);
            }

            @Override
            public Boolean visitUnaryOp(UnaryOp node) {
                return "!".equals(node.op) && isPure(node.operand);
            }
        });
    }

    public static boolean allPure(List<Node> nodes) {
        for (Node node : nodes) {
            if (!isPure(node)) return false;
        }
        return true;
    }

    private static boolean entriesPure(List<Entry> entries) {
        for (Entry entry : entries) {
            if (!isPure(entry.key) || !isPure(entry.value)) return false;
        }
        return true;
    }
}
