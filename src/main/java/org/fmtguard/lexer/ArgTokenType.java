package org.fmtguard.lexer;

/**
 * Token types of the argument-level grammar.
 * <p>
 * This tier understands enough of C expressions to split an argument list: nesting
 * parentheses, commas, literals that may contain parentheses or commas, and the three
 * recognized casts. Whitespace is skipped and never produced as a token.
 */
public enum ArgTokenType {
    COMMENT,
    /** Operators and punctuators, including {@code %} as modulo. */
    SYMBOL,
    LPAREN,
    RPAREN,
    COMMA,
    CHAR,
    STRING,
    INT,
    FLOAT,
    /** {@code (int)}, {@code (float)} or {@code (char*)}. */
    TYPE_CAST,
    IDENTIFIER,
    UNKNOWN
}
