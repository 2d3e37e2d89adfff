package org.fmtguard.lexer;

/**
 * A half-open {@code [start, end)} range of character offsets into a {@link SourceText}.
 * <p>
 * Spans are always taken from tokenizer positions, never recomputed from token text,
 * so diagnostics point at exactly the characters that were scanned.
 */
public record Span(int start, int end) {

    public Span {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span " + start + ".." + end);
        }
    }

    /**
     * Returns an empty span located at the given offset.
     */
    public static Span empty(int offset) {
        return new Span(offset, offset);
    }

    /**
     * Extends a possibly absent span up to the end of {@code other}.
     *
     * @param span  the span accumulated so far, or null
     * @param other the span to append
     * @return {@code other} when nothing was accumulated yet, otherwise {@code span.start..other.end}
     */
    public static Span union(Span span, Span other) {
        return span == null ? other : new Span(span.start, other.end);
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
