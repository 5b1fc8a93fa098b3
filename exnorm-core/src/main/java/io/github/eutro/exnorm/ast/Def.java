package io.github.eutro.exnorm.ast;

import io.github.eutro.exnorm.ext.Meta;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A named function definition clause.
 */
public final class Def extends Node {
    @NotNull
    public final Kind kind;
    @NotNull
    public final String name;
    @NotNull
    public final List<Pattern> params;
    @Nullable
    public final Node guard;
    @NotNull
    public final Node body;

    public Def(Kind kind, String name, List<Pattern> params, @Nullable Node guard, Node body, Meta meta) {
        super(meta);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.name = Objects.requireNonNull(name, "name");
        this.params = Nodes.list(params, "params");
        this.guard = guard;
        this.body = Objects.requireNonNull(body, "body");
    }

    public Def(Kind kind, String name, List<Pattern> params, @Nullable Node guard, Node body) {
        this(kind, name, params, guard, body, Meta.EMPTY);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitDef(this);
    }

    @Override
    public Node map(UnaryOperator<Node> f) {
        Node guard = Nodes.mapNullable(this.guard, f);
        Node body = f.apply(this.body);
        if (guard == this.guard && body == this.body) return this;
        return new Def(kind, name, params, guard, body, meta);
    }

    @Override
    public void forEachChild(Consumer<Node> consumer) {
        Nodes.forNullable(guard, consumer);
        consumer.accept(body);
    }

    @Override
    public void forEachPattern(Consumer<Pattern> consumer) {
        params.forEach(consumer);
    }

    @Override
    public Node mapPatterns(UnaryOperator<Pattern> f) {
        List<Pattern> params = Nodes.mapAll(this.params, f);
        if (params == this.params) return this;
        return new Def(kind, name, params, guard, body, meta);
    }

    @Override
    public Def withMeta(Meta meta) {
        return meta == this.meta ? this : new Def(kind, name, params, guard, body, meta);
    }

    @Override
    protected List<?> components() {
        return Arrays.asList(kind, name, params, guard, body);
    }

    public Def withParams(List<Pattern> params) {
        return params == this.params ? this : new Def(kind, name, params, guard, body, meta);
    }

    public Def withBody(Node body) {
        return body == this.body ? this : new Def(kind, name, params, guard, body, meta);
    }

    /**
     * The macro used to define a function.
     */
    public enum Kind {
        DEF("def"),
        DEFP("defp"),
        DEFMACRO("defmacro"),
        DEFMACROP("defmacrop");

        public final String keyword;

        Kind(String keyword) {
            this.keyword = keyword;
        }
    }
}
