package org.pragmatica.markup.tree;

import java.util.Objects;

/**
 * A range in source text from start (inclusive) to end (exclusive).
 *
 * <p>Spans only serve diagnostics. Two nodes that differ in nothing but their spans
 * print identically.
 */
public record SourceSpan(SourceLocation start, SourceLocation end) {

    /**
     * Span of nodes built programmatically, without source text behind them.
     */
    public static final SourceSpan DETACHED = new SourceSpan(SourceLocation.START, SourceLocation.START);

    public SourceSpan {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Span end " + end + " precedes start " + start);
        }
    }

    public static SourceSpan of(SourceLocation start, SourceLocation end) {
        return new SourceSpan(start, end);
    }

    public static SourceSpan at(SourceLocation location) {
        return new SourceSpan(location, location);
    }

    public int length() {
        return end.offset() - start.offset();
    }

    public boolean isEmpty() {
        return length() == 0;
    }

    public String extract(String source) {
        return source.substring(start.offset(), end.offset());
    }

    /**
     * The smallest span covering both this span and {@code other}.
     */
    public SourceSpan join(SourceSpan other) {
        var newStart = start.offset() <= other.start.offset() ? start : other.start;
        var newEnd = end.offset() >= other.end.offset() ? end : other.end;
        return new SourceSpan(newStart, newEnd);
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
