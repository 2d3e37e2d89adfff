package org.fmtguard.parser;

import org.fmtguard.ir.CType;
import org.fmtguard.lexer.ArgToken;
import org.fmtguard.lexer.ArgTokenType;
import org.fmtguard.lexer.Span;

/**
 * An argument in a function call, e.g. {@code "input"} or {@code (int) 4} in
 * {@code printf("%s %d", "input", (int) 4)}.
 *
 * @param singleToken the token making up the argument if there is exactly one, ignoring comments
 *                    and parentheses; null otherwise
 * @param span        the argument text, excluding surrounding whitespace
 * @param cast        the cast the argument starts with, or null
 */
public record Arg(ArgToken singleToken, Span span, Cast cast) {

    /**
     * A leading {@code (int)}, {@code (float)} or {@code (char*)} cast.
     */
    public record Cast(CType type, Span span) {
    }

    public boolean isStringLiteral() {
        return singleToken != null && singleToken.type() == ArgTokenType.STRING;
    }

    public boolean isIdentifier() {
        return singleToken != null && singleToken.type() == ArgTokenType.IDENTIFIER;
    }
}
