package org.fmtguard.lexer;

import org.fmtguard.ir.CType;

/**
 * A token of the argument-level grammar.
 *
 * @param type     the token type
 * @param span     the full extent of the token, including quotes, prefixes and parentheses
 * @param contents for {@link ArgTokenType#STRING}, the text between the first opening and the last
 *                 closing quote; null otherwise
 * @param castType for {@link ArgTokenType#TYPE_CAST}, the type cast to; null otherwise
 */
public record ArgToken(ArgTokenType type, Span span, Span contents, CType castType) {

    public ArgToken(ArgTokenType type, Span span) {
        this(type, span, null, null);
    }

    public static ArgToken string(Span span, Span contents) {
        return new ArgToken(ArgTokenType.STRING, span, contents, null);
    }

    public static ArgToken typeCast(Span span, CType castType) {
        return new ArgToken(ArgTokenType.TYPE_CAST, span, null, castType);
    }

    public int start() {
        return span.start();
    }

    public int end() {
        return span.end();
    }
}
