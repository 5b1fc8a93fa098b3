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
 * A {@code try} expression with its rescue, catch, else and after sections.
 */
public final class Try extends Node {
    @NotNull
    public final Node body;
    @NotNull
    public final List<Clause> rescueClauses;
    @NotNull
    public final List<Clause> catchClauses;
    @NotNull
    public final List<Clause> elseClauses;
    @Nullable
    public final Node after;

    public Try(Node body, List<Clause> rescueClauses, List<Clause> catchClauses, List<Clause> elseClauses, @Nullable Node after, Meta meta) {
        super(meta);
        this.body = Objects.requireNonNull(body, "body");
        this.rescueClauses = Nodes.list(rescueClauses, "rescueClauses");
        this.catchClauses = Nodes.list(catchClauses, "catchClauses");
        this.elseClauses = Nodes.list(elseClauses, "elseClauses");
        this.after = after;
    }

    public Try(Node body, List<Clause> rescueClauses, List<Clause> catchClauses, List<Clause> elseClauses, @Nullable Node after) {
        this(body, rescueClauses, catchClauses, elseClauses, after, Meta.EMPTY);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitTry(this);
    }

    @Override
    public Node map(UnaryOperator<Node> f) {
        Node body = f.apply(this.body);
        List<Clause> rescueClauses = Nodes.mapAll(this.rescueClauses, it -> it.map(f));
        List<Clause> catchClauses = Nodes.mapAll(this.catchClauses, it -> it.map(f));
        List<Clause> elseClauses = Nodes.mapAll(this.elseClauses, it -> it.map(f));
        Node after = Nodes.mapNullable(this.after, f);
        if (body == this.body && rescueClauses == this.rescueClauses && catchClauses == this.catchClauses && elseClauses == this.elseClauses && after == this.after) return this;
        return new Try(body, rescueClauses, catchClauses, elseClauses, after, meta);
    }

    @Override
    public void forEachChild(Consumer<Node> consumer) {
        consumer.accept(body);
        for (Clause it : rescueClauses) it.forEachChild(consumer);
        for (Clause it : catchClauses) it.forEachChild(consumer);
        for (Clause it : elseClauses) it.forEachChild(consumer);
        Nodes.forNullable(after, consumer);
    }

    @Override
    public void forEachPattern(Consumer<Pattern> consumer) {
        for (Clause it : rescueClauses) consumer.accept(it.pattern);
        for (Clause it : catchClauses) consumer.accept(it.pattern);
        for (Clause it : elseClauses) consumer.accept(it.pattern);
    }

    @Override
    public Node mapPatterns(UnaryOperator<Pattern> f) {
        List<Clause> rescueClauses = Nodes.mapAll(this.rescueClauses, it -> it.mapPattern(f));
        List<Clause> catchClauses = Nodes.mapAll(this.catchClauses, it -> it.mapPattern(f));
        List<Clause> elseClauses = Nodes.mapAll(this.elseClauses, it -> it.mapPattern(f));
        if (rescueClauses == this.rescueClauses && catchClauses == this.catchClauses && elseClauses == this.elseClauses) return this;
        return new Try(body, rescueClauses, catchClauses, elseClauses, after, meta);
    }

    @Override
    public Try withMeta(Meta meta) {
        return meta == this.meta ? this : new Try(body, rescueClauses, catchClauses, elseClauses, after, meta);
    }

    @Override
    protected List<?> components() {
        return Arrays.asList(body, rescueClauses, catchClauses, elseClauses, after);
    }
}
