package io.github.eutro.exnorm.ast;

import io.github.eutro.exnorm.ext.Meta;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * An atom literal, such as {@code :ok}. The value excludes the colon.
 */
public final class Atom extends Node {
    @NotNull
    public final String value;

    public Atom(String value, Meta meta) {
        super(meta);
        this.value = Objects.requireNonNull(value, "value");
    }

    public Atom(String value) {
        this(value, Meta.EMPTY);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitAtom(this);
    }

    @Override
    public Node map(UnaryOperator<Node> f) {
        return this;
    }

    @Override
    public void forEachChild(Consumer<Node> consumer) {
    }

    @Override
    public Atom withMeta(Meta meta) {
        return meta == this.meta ? this : new Atom(value, meta);
    }

    @Override
    protected List<?> components() {
        return Collections.singletonList(value);
    }
}
