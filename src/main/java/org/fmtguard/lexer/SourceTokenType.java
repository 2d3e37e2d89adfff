package org.fmtguard.lexer;

import org.fmtguard.ir.FormatFunction;

/**
 * Token types of the source-level grammar, the coarsest of the three tiers.
 * Whitespace is skipped and never produced as a token.
 */
public enum SourceTokenType {
    COMMENT,
    STRING,
    LPAREN,
    RPAREN,
    PRINTF(FormatFunction.PRINTF),
    SPRINTF(FormatFunction.SPRINTF),
    SNPRINTF(FormatFunction.SNPRINTF),
    // keywords, other identifiers, numbers, character literals and punctuation
    OTHER;

    private final FormatFunction function;

    SourceTokenType() {
        this(null);
    }

    SourceTokenType(FormatFunction function) {
        this.function = function;
    }

    /**
     * The tracked function this token names, or null for every other token type.
     */
    public FormatFunction function() {
        return function;
    }
}
