package io.github.eutro.exnorm.ast;

import io.github.eutro.exnorm.ext.Meta;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A match, {@code pattern = value}. The binder of the language: every name in the pattern is bound, unless pinned.
 */
public final class Match extends Node {
    @NotNull
    public final Pattern pattern;
    @NotNull
    public final Node value;

    public Match(Pattern pattern, Node value, Meta meta) {
        super(meta);
        this.pattern = Objects.requireNonNull(pattern, "pattern");
        this.value = Objects.requireNonNull(value, "value");
    }

    public Match(Pattern pattern, Node value) {
        this(pattern, value, Meta.EMPTY);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitMatch(this);
    }

    @Override
    public Node map(UnaryOperator<Node> f) {
        Node value = f.apply(this.value);
        if (value == this.value) return this;
        return new Match(pattern, value, meta);
    }

    @Override
    public void forEachChild(Consumer<Node> consumer) {
        consumer.accept(value);
    }

    @Override
    public void forEachPattern(Consumer<Pattern> consumer) {
        consumer.accept(pattern);
    }

    @Override
    public Node mapPatterns(UnaryOperator<Pattern> f) {
        Pattern pattern = f.apply(this.pattern);
        if (pattern == this.pattern) return this;
        return new Match(pattern, value, meta);
    }

    @Override
    public Match withMeta(Meta meta) {
        return meta == this.meta ? this : new Match(pattern, value, meta);
    }

    @Override
    protected List<?> components() {
        return Arrays.asList(pattern, value);
    }

    public Match withValue(Node value) {
        return value == this.value ? this : new Match(pattern, value, meta);
    }

    public Match withPattern(Pattern pattern) {
        return pattern == this.pattern ? this : new Match(pattern, value, meta);
    }
}
