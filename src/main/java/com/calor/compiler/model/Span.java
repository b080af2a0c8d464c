package com.calor.compiler.model;

import lombok.Value;

/**
 * Source location of a token or node.
 *
 * Line and column are 1-based. {@code offset} is the 0-based character index into
 * the source and {@code length} the number of characters covered.
 */
@Value
public class Span {

    public static final Span EMPTY = new Span(0, 0, 0, 0, 0, 0);

    int offset;
    int line;
    int column;
    int length;
    int endLine;
    int endColumn;

    /**
     * Single-line span.
     */
    public static Span of(int offset, int line, int column, int length) {
        return new Span(offset, line, column, length, line, column + length);
    }

    /**
     * Smallest span covering both {@code this} and {@code other}.
     */
    public Span union(Span other) {
        if (other == null || other == EMPTY) {
            return this;
        }
        if (this == EMPTY) {
            return other;
        }
        Span first = offset <= other.offset ? this : other;
        Span last = (offset + length) >= (other.offset + other.length) ? this : other;
        return new Span(first.offset, first.line, first.column,
                (last.offset + last.length) - first.offset, last.endLine, last.endColumn);
    }

    public boolean isEmpty() {
        return line == 0;
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
