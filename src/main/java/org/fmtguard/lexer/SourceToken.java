package org.fmtguard.lexer;

/**
 * A token of the source-level grammar.
 */
public record SourceToken(SourceTokenType type, Span span) {

    public int start() {
        return span.start();
    }

    public int end() {
        return span.end();
    }
}
