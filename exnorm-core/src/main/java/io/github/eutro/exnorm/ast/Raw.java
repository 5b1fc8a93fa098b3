package io.github.eutro.exnorm.ast;

import io.github.eutro.exnorm.ext.Meta;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Opaque target-language text, emitted verbatim.
 * <p>
 * This is the unstructured escape hatch of the tree: its contents can only be inspected
 * with {@link io.github.eutro.exnorm.analysis.TokenScan}.
 */
public final class Raw extends Node {
    @NotNull
    public final String code;

    public Raw(String code, Meta meta) {
        super(meta);
        this.code = Objects.requireNonNull(code, "code");
    }

    public Raw(String code) {
        this(code, Meta.EMPTY);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitRaw(this);
    }

    @Override
    public Node map(UnaryOperator<Node> f) {
        return this;
    }

    @Override
    public void forEachChild(Consumer<Node> consumer) {
    }

    @Override
    public Raw withMeta(Meta meta) {
        return meta == this.meta ? this : new Raw(code, meta);
    }

    @Override
    protected List<?> components() {
        return Collections.singletonList(code);
    }
}
