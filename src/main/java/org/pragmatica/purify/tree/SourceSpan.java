package org.pragmatica.purify.tree;

import java.util.Comparator;

/**
 * A range in source text from start (inclusive) to end (exclusive).
 *
 * <p>Spans double as node identity: the rewriter locates the nodes it changes by span,
 * so two distinct nodes of the same kind never share one within a tree.
 */
public record SourceSpan(SourceLocation start, SourceLocation end) {

    public static final Comparator<SourceSpan> SOURCE_ORDER = Comparator
        .comparingInt((SourceSpan span) -> span.start().offset())
        .thenComparingInt(span -> span.end().offset());

    public static SourceSpan of(SourceLocation start, SourceLocation end) {
        return new SourceSpan(start, end);
    }

    public static SourceSpan at(SourceLocation location) {
        return new SourceSpan(location, location);
    }

    /**
     * Span covering a whole physical line, as used by the line-oriented dialects.
     */
    public static SourceSpan ofLine(int line, int offset, int length) {
        return new SourceSpan(SourceLocation.at(line, 1, offset),
                              SourceLocation.at(line, length + 1, offset + length));
    }

    public int length() {
        return end.offset() - start.offset();
    }

    public String extract(String source) {
        return source.substring(start.offset(), end.offset());
    }

    public boolean contains(SourceSpan other) {
        return start.offset() <= other.start.offset() && other.end.offset() <= end.offset();
    }

    public SourceSpan merge(SourceSpan other) {
        var newStart = start.offset() <= other.start.offset() ? start : other.start;
        var newEnd = end.offset() >= other.end.offset() ? end : other.end;
        return new SourceSpan(newStart, newEnd);
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
