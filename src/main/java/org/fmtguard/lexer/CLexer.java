package org.fmtguard.lexer;

import com.ibm.icu.lang.UCharacter;
import com.ibm.icu.lang.UProperty;

/**
 * Base class for the three C tokenizers.
 * <p>
 * All of them scan a window {@code [start, limit)} of the same {@link SourceText} and report
 * absolute offsets, so tokens produced by different grammars over overlapping regions of the
 * file can be compared and combined directly. Subclasses implement {@code next()} returning
 * {@code null} once the window is exhausted.
 * <p>
 * The shared helpers cover the lexical elements every tier needs: comments, string and
 * character literals with C escape sequences, identifiers and whitespace.
 */
public abstract class CLexer {

    protected final SourceText source;
    protected final String input;
    protected final int limit;
    protected int position;
    // Start offset of the token most recently returned by next()
    protected int tokenStart;

    protected CLexer(SourceText source, int start, int limit) {
        if (start < 0 || limit > source.length() || start > limit) {
            throw new IllegalArgumentException("Invalid lexer window " + start + ".." + limit);
        }
        this.source = source;
        this.input = source.text();
        this.limit = limit;
        this.position = start;
        this.tokenStart = start;
    }

    public SourceText getSource() {
        return source;
    }

    /**
     * Offset just past the most recently returned token, or of the next character to scan.
     */
    public int getPosition() {
        return position;
    }

    /**
     * Moves the lexer to an absolute offset. Used to hand a position over between tiers.
     */
    public void reset(int newPosition) {
        if (newPosition < 0 || newPosition > limit) {
            throw new IllegalArgumentException("Position " + newPosition + " outside lexer window");
        }
        this.position = newPosition;
    }

    /**
     * Span of the most recently returned token.
     */
    public Span tokenSpan() {
        return new Span(tokenStart, position);
    }

    protected boolean isAtEnd() {
        return position >= limit;
    }

    protected char peek() {
        return isAtEnd() ? '\0' : input.charAt(position);
    }

    protected char peekAhead(int offset) {
        int pos = position + offset;
        return pos >= limit ? '\0' : input.charAt(pos);
    }

    protected boolean match(char expected) {
        if (peek() != expected || isAtEnd()) return false;
        position++;
        return true;
    }

    protected boolean lookingAt(String text) {
        return position + text.length() <= limit && input.startsWith(text, position);
    }

    protected int currentCodePoint() {
        if (isAtEnd()) return -1;
        char c1 = input.charAt(position);
        if (Character.isHighSurrogate(c1) && position + 1 < limit) {
            char c2 = input.charAt(position + 1);
            if (Character.isLowSurrogate(c2)) {
                return Character.toCodePoint(c1, c2);
            }
        }
        return c1;
    }

    protected void advanceCodePoint() {
        int cp = currentCodePoint();
        if (cp >= 0) {
            position += Character.charCount(cp);
        }
    }

    protected static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\u000B' || c == '\r' || c == '\n' || c == '\f';
    }

    protected static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    protected static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    protected static boolean isOctalDigit(char c) {
        return c >= '0' && c <= '7';
    }

    protected static boolean isIdentifierStart(int codePoint) {
        return codePoint == '_' || codePoint == '$' || UCharacter.hasBinaryProperty(codePoint, UProperty.XID_START);
    }

    protected static boolean isIdentifierPart(int codePoint) {
        return codePoint == '_' || codePoint == '$' || UCharacter.hasBinaryProperty(codePoint, UProperty.XID_CONTINUE);
    }

    protected void skipWhitespace() {
        while (!isAtEnd() && isWhitespace(peek())) {
            position++;
        }
    }

    /**
     * Consumes a line or block comment at the current position.
     * <p>
     * A block comment without its closing {@code *}{@code /} is not a comment: nothing is
     * consumed and the caller falls back to its catch-all token.
     *
     * @return true if a comment was consumed
     */
    protected boolean scanComment() {
        if (peek() != '/') return false;
        char next = peekAhead(1);
        if (next == '/') {
            position += 2;
            while (!isAtEnd() && peek() != '\n' && peek() != '\r') {
                position++;
            }
            return true;
        }
        if (next == '*') {
            int close = input.indexOf("*/", position + 2);
            if (close < 0 || close + 2 > limit) {
                return false;
            }
            position = close + 2;
            return true;
        }
        return false;
    }

    /**
     * Consumes an identifier at the current position.
     *
     * @return true if an identifier was consumed
     */
    protected boolean scanIdentifier() {
        if (!isIdentifierStart(currentCodePoint())) return false;
        advanceCodePoint();
        while (!isAtEnd() && isIdentifierPart(currentCodePoint())) {
            advanceCodePoint();
        }
        return true;
    }

    /**
     * Consumes one string literal, or a run of adjacent string literals separated only by
     * whitespace, which C concatenates. The position is left just after the last closing quote.
     *
     * @return true if at least one complete literal was consumed
     */
    protected boolean scanStringLiterals() {
        int lastEnd = -1;
        while (true) {
            int pieceStart = position;
            if (!scanStringPiece()) {
                position = pieceStart;
                break;
            }
            lastEnd = position;
            skipWhitespace();
        }
        if (lastEnd < 0) {
            return false;
        }
        position = lastEnd;
        return true;
    }

    private boolean scanStringPiece() {
        skipEncodingPrefix(true);
        if (!match('"')) return false;
        while (!isAtEnd()) {
            char c = peek();
            if (c == '"') {
                position++;
                return true;
            }
            if (c == '\n') {
                return false;
            }
            if (c == '\\') {
                if (!scanEscape()) return false;
            } else {
                position++;
            }
        }
        return false;
    }

    /**
     * Consumes a character literal such as {@code 'a'}, {@code '\n'} or {@code L'x'}.
     *
     * @return true if a complete literal was consumed, otherwise nothing is consumed
     */
    protected boolean scanCharLiteral() {
        int start = position;
        skipEncodingPrefix(false);
        if (!match('\'')) {
            position = start;
            return false;
        }
        while (!isAtEnd()) {
            char c = peek();
            if (c == '\'') {
                position++;
                return true;
            }
            if (c == '\n') {
                break;
            }
            if (c == '\\') {
                if (!scanEscape()) break;
            } else {
                position++;
            }
        }
        position = start;
        return false;
    }

    // u8, u, U or L in front of a string; u, U or L in front of a character literal
    private void skipEncodingPrefix(boolean allowUtf8) {
        char quote = allowUtf8 ? '"' : '\'';
        if (allowUtf8 && peek() == 'u' && peekAhead(1) == '8' && peekAhead(2) == quote) {
            position += 2;
        } else if ((peek() == 'u' || peek() == 'U' || peek() == 'L') && peekAhead(1) == quote) {
            position++;
        }
    }

    /**
     * Consumes an escape sequence starting at a backslash.
     */
    protected boolean scanEscape() {
        if (peek() != '\\') return false;
        char c = peekAhead(1);
        switch (c) {
            case '\'', '"', '%', '?', '\\', 'a', 'b', 'e', 'f', 'n', 'r', 't', 'v' -> {
                position += 2;
                return true;
            }
            case 'x', 'u' -> {
                if (!isHexDigit(peekAhead(2))) return false;
                position += 2;
                while (isHexDigit(peek()) && !isAtEnd()) position++;
                return true;
            }
            case '\n' -> {
                position += 2;
                return true;
            }
            case '\r' -> {
                if (peekAhead(2) != '\n') return false;
                position += 3;
                return true;
            }
            default -> {
                if (!isOctalDigit(c)) return false;
                position += 2;
                while (isOctalDigit(peek()) && !isAtEnd()) position++;
                return true;
            }
        }
    }
}
