package io.github.eutro.exnorm.ast;

import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A bitstring pattern, {@code <<a::8, rest::binary>>}.
 */
public final class PBinary extends Pattern {
    @NotNull
    public final List<Segment> segments;

    public PBinary(List<Segment> segments) {
        this.segments = Nodes.list(segments, "segments");
    }

    @Override
    public <R> R accept(PatternVisitor<R> visitor) {
        return visitor.visitPBinary(this);
    }

    @Override
    public Pattern map(UnaryOperator<Pattern> f) {
        List<Segment> segments = Nodes.mapAll(this.segments, it -> it.map(f));
        if (segments == this.segments) return this;
        return new PBinary(segments);
    }

    @Override
    public void forEachChild(Consumer<Pattern> consumer) {
        for (Segment it : segments) it.forEachChild(consumer);
    }

    @Override
    protected List<?> components() {
        return Collections.singletonList(segments);
    }
}
