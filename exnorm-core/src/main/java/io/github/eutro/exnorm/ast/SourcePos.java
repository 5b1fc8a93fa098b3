package io.github.eutro.exnorm.ast;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A position in the original program.
 */
public final class SourcePos {
    @Nullable
    public final String file;
    public final int line;
    public final int column;

    public SourcePos(@Nullable String file, int line, int column) {
        this.file = file;
        this.line = line;
        this.column = column;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourcePos)) return false;
        SourcePos that = (SourcePos) o;
        return line == that.line && column == that.column && Objects.equals(file, that.file);
    }

    @Override
    public int hashCode() {
        return Objects.hash(file, line, column);
    }

    @Override
    public String toString() {
        return (file == null ? "" : file + ":") + line + ":" + column;
    }
}
