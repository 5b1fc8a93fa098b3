package io.github.eutro.exnorm.ast;

import io.github.eutro.exnorm.ext.Meta;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A sequence of statements, evaluating to the last one.
 */
public final class Block extends Node {
    @NotNull
    public final List<Node> statements;

    public Block(List<Node> statements, Meta meta) {
        super(meta);
        this.statements = Nodes.list(statements, "statements");
    }

    public Block(List<Node> statements) {
        this(statements, Meta.EMPTY);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitBlock(this);
    }

    @Override
    public Node map(UnaryOperator<Node> f) {
        List<Node> statements = Nodes.mapAll(this.statements, f);
        if (statements == this.statements) return this;
        return new Block(statements, meta);
    }

    @Override
    public void forEachChild(Consumer<Node> consumer) {
        statements.forEach(consumer);
    }

    @Override
    public Block withMeta(Meta meta) {
        return meta == this.meta ? this : new Block(statements, meta);
    }

    @Override
    protected List<?> components() {
        return Collections.singletonList(statements);
    }

    public Block withStatements(List<Node> statements) {
        return statements == this.statements ? this : new Block(statements, meta);
    }
}
