package io.github.eutro.exnorm.ast;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A segment of a {@link PBinary}: {@code value::spec}. The size/type spec is kept as text.
 */
public final class Segment {
    @NotNull
    public final Pattern value;
    @Nullable
    public final String spec;

    public Segment(Pattern value, @Nullable String spec) {
        this.value = Objects.requireNonNull(value, "value");
        this.spec = spec;
    }

    public Segment map(UnaryOperator<Pattern> f) {
        Pattern value = f.apply(this.value);
        return value == this.value ? this : new Segment(value, spec);
    }

    public void forEachChild(Consumer<Pattern> consumer) {
        consumer.accept(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Segment)) return false;
        Segment segment = (Segment) o;
        return value.equals(segment.value) && Objects.equals(spec, segment.spec);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, spec);
    }
}
