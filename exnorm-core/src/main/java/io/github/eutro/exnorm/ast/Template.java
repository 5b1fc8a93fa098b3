package io.github.eutro.exnorm.ast;

import io.github.eutro.exnorm.ext.Meta;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A templated text fragment, such as a {@code ~H} sigil. Treated as opaque like {@link Raw}.
 */
public final class Template extends Node {
    @NotNull
    public final String sigil;
    @NotNull
    public final String text;

    public Template(String sigil, String text, Meta meta) {
        super(meta);
        this.sigil = Objects.requireNonNull(sigil, "sigil");
        this.text = Objects.requireNonNull(text, "text");
    }

    public Template(String sigil, String text) {
        this(sigil, text, Meta.EMPTY);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitTemplate(this);
    }

    @Override
    public Node map(UnaryOperator<Node> f) {
        return this;
    }

    @Override
    public void forEachChild(Consumer<Node> consumer) {
    }

    @Override
    public Template withMeta(Meta meta) {
        return meta == this.meta ? this : new Template(sigil, text, meta);
    }

    @Override
    protected List<?> components() {
        return Arrays.asList(sigil, text);
    }
}
