package org.pragmatica.markup.tree;

/**
 * A position in source text (line and column, both 1-based; offset 0-based in chars).
 */
public record SourceLocation(int line, int column, int offset) {

    public static final SourceLocation START = new SourceLocation(1, 1, 0);

    public SourceLocation {
        if (line < 1 || column < 1 || offset < 0) {
            throw new IllegalArgumentException("Invalid source location " + line + ":" + column + "@" + offset);
        }
    }

    public static SourceLocation at(int line, int column, int offset) {
        return new SourceLocation(line, column, offset);
    }

    public boolean isBefore(SourceLocation other) {
        return offset < other.offset;
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
