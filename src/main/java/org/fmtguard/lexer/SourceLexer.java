package org.fmtguard.lexer;

import org.fmtguard.ir.FormatFunction;

/**
 * Tokenizer for the whole C file.
 * <p>
 * It only needs to be precise about the constructs that could hide or fake a call to a
 * tracked function: comments and string or character literals are consumed as a whole, so
 * {@code printf} inside them is never reported, and identifiers are consumed as a whole, so
 * {@code printf_wrapper} is not mistaken for {@code printf}. Everything else is
 * {@link SourceTokenType#OTHER}.
 * <p>
 * Tokens are produced lazily by {@link #next()}. Argument scanning takes over from the
 * position after a call's opening parenthesis and hands back the position after the closing
 * one through {@link #reset(int)}.
 */
public class SourceLexer extends CLexer {

    public SourceLexer(SourceText source) {
        super(source, 0, source.length());
    }

    /**
     * Returns the next token, or null at end of input.
     */
    public SourceToken next() {
        skipWhitespace();
        if (isAtEnd()) {
            return null;
        }
        tokenStart = position;
        SourceTokenType type = scanToken();
        return new SourceToken(type, tokenSpan());
    }

    private SourceTokenType scanToken() {
        char c = peek();
        if (c == '/' && scanComment()) {
            return SourceTokenType.COMMENT;
        }
        if (c == '"' || c == 'u' || c == 'U' || c == 'L') {
            if (scanStringLiterals()) {
                return SourceTokenType.STRING;
            }
        }
        if (c == '\'' || c == 'u' || c == 'U' || c == 'L') {
            if (scanCharLiteral()) {
                return SourceTokenType.OTHER;
            }
        }
        if (c == '(') {
            position++;
            return SourceTokenType.LPAREN;
        }
        if (c == ')') {
            position++;
            return SourceTokenType.RPAREN;
        }
        if (scanIdentifier()) {
            return classifyIdentifier(tokenStart, position);
        }
        if (isDigit(c)) {
            // pp-number: digits, letters, dots and signed exponents all belong to one token
            position++;
            while (!isAtEnd()) {
                char d = peek();
                if ((d == '+' || d == '-') && "eEpP".indexOf(input.charAt(position - 1)) >= 0) {
                    position++;
                } else if (d == '.' || isIdentifierPart(currentCodePoint())) {
                    advanceCodePoint();
                } else {
                    break;
                }
            }
            return SourceTokenType.OTHER;
        }
        advanceCodePoint();
        return SourceTokenType.OTHER;
    }

    private SourceTokenType classifyIdentifier(int start, int end) {
        for (FormatFunction function : FormatFunction.values()) {
            String name = function.functionName();
            if (end - start == name.length() && input.startsWith(name, start)) {
                return function.sourceTokenType();
            }
        }
        return SourceTokenType.OTHER;
    }
}
