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
 * A lexical directive: {@code alias}, {@code import}, {@code use} or {@code require}.
 */
public final class Directive extends Node {
    @NotNull
    public final Kind kind;
    @NotNull
    public final String module;
    @Nullable
    public final Node options;

    public Directive(Kind kind, String module, @Nullable Node options, Meta meta) {
        super(meta);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.module = Objects.requireNonNull(module, "module");
        this.options = options;
    }

    public Directive(Kind kind, String module, @Nullable Node options) {
        this(kind, module, options, Meta.EMPTY);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitDirective(this);
    }

    @Override
    public Node map(UnaryOperator<Node> f) {
        Node options = Nodes.mapNullable(this.options, f);
        if (options == this.options) return this;
        return new Directive(kind, module, options, meta);
    }

    @Override
    public void forEachChild(Consumer<Node> consumer) {
        Nodes.forNullable(options, consumer);
    }

    @Override
    public Directive withMeta(Meta meta) {
        return meta == this.meta ? this : new Directive(kind, module, options, meta);
    }

    @Override
    protected List<?> components() {
        return Arrays.asList(kind, module, options);
    }

    /**
     * The directive keyword.
     */
    public enum Kind {
        ALIAS("alias"),
        IMPORT("import"),
        USE("use"),
        REQUIRE("require");

        public final String keyword;

        Kind(String keyword) {
            this.keyword = keyword;
        }
    }
}
