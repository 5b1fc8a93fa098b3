package io.github.eutro.exnorm.ast;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A generator of a {@link For}: {@code pattern <- source}, or {@code <<pattern <- source>>}.
 */
public final class Generator {
    @NotNull
    public final Pattern pattern;
    @NotNull
    public final Node source;
    public final boolean bitstring;

    public Generator(Pattern pattern, Node source, boolean bitstring) {
        this.pattern = Objects.requireNonNull(pattern, "pattern");
        this.source = Objects.requireNonNull(source, "source");
        this.bitstring = bitstring;
    }

    public Generator(Pattern pattern, Node source) {
        this(pattern, source, false);
    }

    public Generator map(UnaryOperator<Node> f) {
        Node source = f.apply(this.source);
        return source == this.source ? this : new Generator(pattern, source, bitstring);
    }

    public Generator mapPattern(UnaryOperator<Pattern> f) {
        Pattern pattern = f.apply(this.pattern);
        return pattern == this.pattern ? this : new Generator(pattern, source, bitstring);
    }

    public void forEachChild(Consumer<Node> consumer) {
        consumer.accept(source);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Generator)) return false;
        Generator that = (Generator) o;
        return bitstring == that.bitstring && pattern.equals(that.pattern) && source.equals(that.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pattern, source, bitstring);
    }
}
