package org.talkpp.compiler.tree;

/**
 * A position in source text. Line and column are 1-based and count code points; {@code offset}
 * is the 0-based char index and {@code byteOffset} the 0-based offset in the UTF-8 encoding.
 */
public record SourceLocation(int line, int column, int offset, int byteOffset) {

    public static final SourceLocation START = new SourceLocation(1, 1, 0, 0);

    public static SourceLocation at(int line, int column, int offset, int byteOffset) {
        return new SourceLocation(line, column, offset, byteOffset);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
