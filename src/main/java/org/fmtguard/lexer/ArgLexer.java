package org.fmtguard.lexer;

import org.fmtguard.ir.CType;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tokenizer for the contents of a call's argument list.
 * <p>
 * It starts right after the opening parenthesis of a call and is driven one token at a time
 * by the argument splitter, which decides where the list ends. The lexer itself has no notion
 * of nesting.
 */
public class ArgLexer extends CLexer {

    private static final String EXPONENT = "[eE][+-]?[0-9]+";
    private static final String HEX_EXPONENT = "[pP][+-]?[0-9]+";
    private static final String INT_SUFFIX = "(?:[uU](?:ll|LL|[lL])?|(?:ll|LL|[lL])[uU]?)";

    private static final Pattern INT_LITERAL = Pattern.compile(
            "(?:0[xX][0-9a-fA-F]+|0[bB][01]+|[1-9][0-9]*|0[0-7]*)" + INT_SUFFIX + "?");

    private static final Pattern FLOAT_LITERAL = Pattern.compile(
            "(?:[0-9]+" + EXPONENT
                    + "|[0-9]*\\.[0-9]+(?:" + EXPONENT + ")?"
                    + "|[0-9]+\\.(?:" + EXPONENT + ")?"
                    + "|0[xX](?:[0-9a-fA-F]+" + HEX_EXPONENT
                    + "|[0-9a-fA-F]*\\.[0-9a-fA-F]+" + HEX_EXPONENT
                    + "|[0-9a-fA-F]+\\." + HEX_EXPONENT + "))[fFlL]?");

    // Longest first, so that the first match is the maximal munch
    private static final String[] PUNCTUATORS = {
            "...", ">>=", "<<=",
            "+=", "-=", "*=", "/=", "%=", "&=", "^=", "|=",
            ">>", "<<", "++", "--", "->", "&&", "||", "<=", ">=", "==", "!=",
            "<%", "%>", "<:", ":>",
    };

    private static final String SINGLE_PUNCTUATORS = ";{}:=[].&!~-+*/%<>^|?\\#";

    /**
     * Creates a lexer that starts at {@code start} and may run to the end of the source.
     */
    public ArgLexer(SourceText source, int start) {
        super(source, start, source.length());
    }

    /**
     * Returns the next token, or null at end of input.
     */
    public ArgToken next() {
        skipWhitespace();
        if (isAtEnd()) {
            return null;
        }
        tokenStart = position;
        char c = peek();

        if (c == '/' && scanComment()) {
            return token(ArgTokenType.COMMENT);
        }
        if (c == '(') {
            CType cast = scanTypeCast();
            if (cast != null) {
                return ArgToken.typeCast(tokenSpan(), cast);
            }
            position++;
            return token(ArgTokenType.LPAREN);
        }
        if (c == ')') {
            position++;
            return token(ArgTokenType.RPAREN);
        }
        if (c == ',') {
            position++;
            return token(ArgTokenType.COMMA);
        }
        if (c == '"' || c == 'u' || c == 'U' || c == 'L') {
            if (scanStringLiterals()) {
                return ArgToken.string(tokenSpan(), stringContents(tokenStart, position));
            }
        }
        if (c == '\'' || c == 'u' || c == 'U' || c == 'L') {
            if (scanCharLiteral()) {
                return token(ArgTokenType.CHAR);
            }
        }
        if (isDigit(c) || (c == '.' && isDigit(peekAhead(1)))) {
            return scanNumber();
        }
        if (scanIdentifier()) {
            return token(ArgTokenType.IDENTIFIER);
        }
        for (String punctuator : PUNCTUATORS) {
            if (lookingAt(punctuator)) {
                position += punctuator.length();
                return token(ArgTokenType.SYMBOL);
            }
        }
        if (SINGLE_PUNCTUATORS.indexOf(c) >= 0) {
            position++;
            return token(ArgTokenType.SYMBOL);
        }
        advanceCodePoint();
        return token(ArgTokenType.UNKNOWN);
    }

    private ArgToken token(ArgTokenType type) {
        return new ArgToken(type, tokenSpan());
    }

    /**
     * Recognizes {@code (int)}, {@code (float)} and {@code (char*)}, allowing blanks around the
     * type name. Nothing is consumed unless the whole cast matches.
     */
    private CType scanTypeCast() {
        int start = position;
        position++;
        skipWhitespace();
        CType type = null;
        if (scanKeyword("int")) {
            type = CType.INT;
        } else if (scanKeyword("float")) {
            type = CType.FLOAT;
        } else if (scanKeyword("char")) {
            skipWhitespace();
            if (match('*')) {
                type = CType.STRING;
            }
        }
        if (type != null) {
            skipWhitespace();
            if (match(')')) {
                return type;
            }
        }
        position = start;
        return null;
    }

    private boolean scanKeyword(String keyword) {
        if (!lookingAt(keyword)) {
            return false;
        }
        int end = position + keyword.length();
        if (end < limit && isIdentifierPart(input.codePointAt(end))) {
            return false;
        }
        position = end;
        return true;
    }

    private ArgToken scanNumber() {
        int intEnd = matchEnd(INT_LITERAL);
        int floatEnd = matchEnd(FLOAT_LITERAL);
        if (floatEnd > intEnd) {
            position = floatEnd;
            return token(ArgTokenType.FLOAT);
        }
        if (intEnd > position) {
            position = intEnd;
            return token(ArgTokenType.INT);
        }
        // every digit starts an INT literal and a dot before a digit a FLOAT one
        position++;
        return token(ArgTokenType.UNKNOWN);
    }

    private int matchEnd(Pattern pattern) {
        Matcher matcher = pattern.matcher(input);
        matcher.region(position, limit);
        return matcher.lookingAt() ? matcher.end() : -1;
    }

    /**
     * Span between the first opening quote and the last closing quote of a string literal token.
     */
    private Span stringContents(int start, int end) {
        int open = input.indexOf('"', start);
        int close = input.lastIndexOf('"', end - 1);
        return new Span(open + 1, close);
    }
}
