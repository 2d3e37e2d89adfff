package org.fmtguard.lexer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Immutable holder of the C source being analyzed.
 * <p>
 * Everything the analyzer produces refers back into this text through {@link Span}s;
 * text is only materialized when rendering output or reporting diagnostics.
 */
public final class SourceText {
    private final String text;
    // Offsets of the first character of every line, computed on first lookup
    private int[] lineStarts;

    public SourceText(String text) {
        if (text == null) {
            throw new IllegalArgumentException("source text must not be null");
        }
        this.text = text;
    }

    public String text() {
        return text;
    }

    public int length() {
        return text.length();
    }

    public char charAt(int offset) {
        return text.charAt(offset);
    }

    public String slice(Span span) {
        return text.substring(span.start(), span.end());
    }

    /**
     * Appends the text covered by {@code span} without creating an intermediate string.
     */
    public void appendTo(StringBuilder sb, Span span) {
        sb.append(text, span.start(), span.end());
    }

    /**
     * Returns the 1-based line number containing the given offset.
     */
    public int lineNumber(int offset) {
        int[] starts = lineStarts();
        int index = Arrays.binarySearch(starts, offset);
        return index >= 0 ? index + 1 : -index - 1;
    }

    /**
     * Returns the 1-based column of the given offset, counted in code points.
     */
    public int columnNumber(int offset) {
        int lineStart = lineStarts()[lineNumber(offset) - 1];
        return text.codePointCount(lineStart, Math.min(offset, text.length())) + 1;
    }

    /**
     * Returns the span of the given 1-based line, excluding its line terminator.
     */
    public Span lineSpan(int line) {
        int[] starts = lineStarts();
        int start = starts[line - 1];
        int end = line < starts.length ? starts[line] - 1 : text.length();
        if (end > start && text.charAt(end - 1) == '\r') {
            end--;
        }
        return new Span(start, Math.max(start, end));
    }

    public int lineCount() {
        return lineStarts().length;
    }

    private int[] lineStarts() {
        if (lineStarts == null) {
            List<Integer> starts = new ArrayList<>();
            starts.add(0);
            for (int i = 0; i < text.length(); i++) {
                if (text.charAt(i) == '\n') {
                    starts.add(i + 1);
                }
            }
            lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
        }
        return lineStarts;
    }

    @Override
    public String toString() {
        return "SourceText{length=" + text.length() + "}";
    }
}
