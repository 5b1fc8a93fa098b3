package io.github.eutro.exnorm.ast;

import io.github.eutro.exnorm.ext.Meta;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A module name, such as {@code Enum} or {@code MyApp.Repo}.
 */
public final class ModuleRef extends Node {
    @NotNull
    public final String name;

    public ModuleRef(String name, Meta meta) {
        super(meta);
        this.name = Objects.requireNonNull(name, "name");
    }

    public ModuleRef(String name) {
        this(name, Meta.EMPTY);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitModuleRef(this);
    }

    @Override
    public Node map(UnaryOperator<Node> f) {
        return this;
    }

    @Override
    public void forEachChild(Consumer<Node> consumer) {
    }

    @Override
    public ModuleRef withMeta(Meta meta) {
        return meta == this.meta ? this : new ModuleRef(name, meta);
    }

    @Override
    protected List<?> components() {
        return Collections.singletonList(name);
    }
}
