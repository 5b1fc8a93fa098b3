package io.github.eutro.exnorm.passes.fold;

import io.github.eutro.exnorm.analysis.Binders;
import io.github.eutro.exnorm.ast.*;
import io.github.eutro.exnorm.passes.TreePass;
import io.github.eutro.exnorm.transform.Renamer;
import io.github.eutro.exnorm.transform.Transformer;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * A pass which removes local copies of the accumulator in a reducer.
 * <p>
 * In {@code fn elem, acc -> ... end}, a statement {@code list = acc} followed by at least one
 * append to itself ({@code list = list ++ [e]}, {@code list = Enum.concat(list, [e])} or
 * {@code list = List.insert_at(list, -1, e)}) is removed, and {@code list} is renamed to
 * {@code acc} from there on. This requires {@code acc} to be unmentioned after the copy.
 */
public class AccumulatorAliasUnification implements TreePass {
    /**
     * An instance of this pass.
     */
    public static final AccumulatorAliasUnification INSTANCE = new AccumulatorAliasUnification();

    @Override
    public Node run(Node root) {
        return Transformer.transform(root, (node, ctx) -> {
            if (!(node instanceof Fn) || !Reducers.isReducer((Fn) node, ctx)) return node;
            Fn fn = (Fn) node;
            FnClause clause = fn.clauses.get(0);
            if (!(clause.params.get(0) instanceof PVar) || !(clause.params.get(1) instanceof PVar)) return node;
            String elem = ((PVar) clause.params.get(0)).name;
            String acc = ((PVar) clause.params.get(1)).name;
            List<Node> statements = Nodes.statements(clause.body);
            List<Node> unified = statements;
            for (int k = 0; k < unified.size(); k++) {
                List<Node> next = unify(unified, k, elem, acc);
                if (next != null) {
                    unified = next;
                    k--;
                }
            }
            return unified == statements ? node : Reducers.withStatements(fn, unified);
        });
    }

    @Nullable
    private static List<Node> unify(List<Node> statements, int k, String elem, String acc) {
        Node statement = statements.get(k);
        if (!(statement instanceof Match)) return null;
        Match copy = (Match) statement;
        if (!(copy.pattern instanceof PVar) || !Nodes.isVar(copy.value, acc)) return null;
        String alias = ((PVar) copy.pattern).name;
        if (alias.equals(acc) || alias.equals(elem)) return null;
        List<Node> rest = statements.subList(k + 1, statements.size());
        if (rest.isEmpty()) return null;
        boolean appended = false;
        for (Node later : rest) {
            if (Binders.mentionedIn(later).contains(acc)) return null;
            if (isSelfAppend(later, alias)) appended = true;
        }
        if (!appended) return null;
        List<Node> renamed = Renamer.rename(rest, alias, acc);
        if (renamed == null) return null;
        List<Node> out = new ArrayList<>(statements.subList(0, k));
        out.addAll(renamed);
        return out;
    }

    /**
     * Whether the statement is {@code name = name ++ [e]}, or one of its spellings.
     *
     * @param statement The statement.
     * @param name      The name.
     * @return Whether it is an append of one element to itself.
     */
    static boolean isSelfAppend(Node statement, String name) {
        if (!(statement instanceof Match)) return false;
        Match match = (Match) statement;
        if (!(match.pattern instanceof PVar) || !((PVar) match.pattern).name.equals(name)) return false;
        Node value = Nodes.unwrapParens(match.value);
        if (value instanceof BinOp) {
            BinOp op = (BinOp) value;
            return "++".equals(op.op) && Nodes.isVar(op.left, name) && isSingleton(op.right);
        }
        if (Nodes.isRemoteCall(value, "Enum", "concat")) {
            List<Node> args = ((RemoteCall) value).args;
            return args.size() == 2 && Nodes.isVar(args.get(0), name) && isSingleton(args.get(1));
        }
        if (Nodes.isRemoteCall(value, "List", "insert_at")) {
            List<Node> args = ((RemoteCall) value).args;
            return args.size() == 3 && Nodes.isVar(args.get(0), name) && isMinusOne(args.get(1));
        }
        return false;
    }

    private static boolean isSingleton(Node node) {
        return node instanceof ListLit && ((ListLit) node).elements.size() == 1;
    }

    private static boolean isMinusOne(Node node) {
        if (node instanceof IntLit) return ((IntLit) node).value == -1;
        if (node instanceof UnaryOp) {
            UnaryOp op = (UnaryOp) node;
            return "-".equals(op.op) && op.operand instanceof IntLit && ((IntLit) op.operand).value == 1;
        }
        return false;
    }
}
