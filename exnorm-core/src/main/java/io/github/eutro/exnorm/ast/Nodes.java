package io.github.eutro.exnorm.ast;

import io.github.eutro.exnorm.ext.Meta;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Helpers for building and taking apart nodes.
 */
public final class Nodes {
    private Nodes() {
    }

    /**
     * Copy a list into an unmodifiable one, rejecting null elements.
     *
     * @param list The list.
     * @param <T>  The element type.
     * @return The copy.
     */
    public static <T> List<T> copy(List<? extends T> list) {
        List<T> copy = new ArrayList<>(list.size());
        for (T t : list) {
            copy.add(Objects.requireNonNull(t, "list element"));
        }
        return Collections.unmodifiableList(copy);
    }

    /**
     * Map every element of a list, returning the same list if no element changed (by identity).
     *
     * @param list The list.
     * @param f    The function.
     * @param <T>  The element type.
     * @return The mapped list.
     */
    public static <T> List<T> mapAll(List<T> list, UnaryOperator<T> f) {
        List<T> mapped = null;
        for (int i = 0; i < list.size(); i++) {
            T t = list.get(i);
            T m = f.apply(t);
            if (m != t && mapped == null) {
                mapped = new ArrayList<>(list.subList(0, i));
            }
            if (mapped != null) mapped.add(m);
        }
        return mapped == null ? list : Collections.unmodifiableList(mapped);
    }

    @Contract("null, _ -> null; !null, _ -> !null")
    public static @Nullable Node mapNullable(@Nullable Node node, UnaryOperator<Node> f) {
        return node == null ? null : f.apply(node);
    }

    public static void forNullable(@Nullable Node node, Consumer<Node> consumer) {
        if (node != null) consumer.accept(node);
    }

    /**
     * Get the statements of a body: the statements of a block, or the node itself.
     *
     * @param body The body.
     * @return The statements.
     */
    public static List<Node> statements(Node body) {
        if (body instanceof Block) return ((Block) body).statements;
        return Collections.singletonList(body);
    }

    /**
     * Build a body from statements: the single statement itself, or a block.
     *
     * @param statements The statements.
     * @param meta       The metadata for a block, if one is built.
     * @return The body.
     */
    public static Node sequence(List<Node> statements, Meta meta) {
        if (statements.size() == 1) return statements.get(0);
        return new Block(statements, meta);
    }

    /**
     * Strip any number of parentheses.
     *
     * @param node The node.
     * @return The innermost parenthesised node.
     */
    public static Node unwrapParens(Node node) {
        while (node instanceof Paren) {
            node = ((Paren) node).inner;
        }
        return node;
    }

    /**
     * Strip parentheses and single-statement blocks.
     *
     * @param node The node.
     * @return The innermost node.
     */
    public static Node unwrap(Node node) {
        while (true) {
            if (node instanceof Paren) {
                node = ((Paren) node).inner;
            } else if (node instanceof Block && ((Block) node).statements.size() == 1) {
                node = ((Block) node).statements.get(0);
            } else {
                return node;
            }
        }
    }

    /**
     * Whether the node is a read of the variable with the given name.
     *
     * @param node The node.
     * @param name The name.
     * @return Whether it is such a read.
     */
    public static boolean isVar(Node node, String name) {
        return node instanceof Var && ((Var) node).name.equals(name);
    }

    /**
     * Whether the node is a remote call to the given module and function.
     *
     * @param node     The node.
     * @param module   The module name.
     * @param function The function name.
     * @return Whether it is such a call.
     */
    public static boolean isRemoteCall(Node node, String module, String function) {
        if (!(node instanceof RemoteCall)) return false;
        RemoteCall call = (RemoteCall) node;
        return call.function.equals(function)
                && call.module instanceof ModuleRef
                && ((ModuleRef) call.module).name.equals(module);
    }

    static <T> List<T> list(List<? extends T> list, String what) {
        return copy(Objects.requireNonNull(list, what));
    }
}
