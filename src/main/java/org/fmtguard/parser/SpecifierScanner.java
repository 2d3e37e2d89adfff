package org.fmtguard.parser;

import org.fmtguard.ir.Specifier;
import org.fmtguard.lexer.FormatLexer;
import org.fmtguard.lexer.FormatToken;
import org.fmtguard.lexer.SourceText;
import org.fmtguard.lexer.Span;

/**
 * Produces the specifiers of a format string one at a time, keeping track of the literal
 * text around them.
 */
public class SpecifierScanner {

    private final FormatLexer lexer;
    private final Span contents;
    // text between the previous specifier and the one last returned
    private Span before;
    private int remainderStart;

    public SpecifierScanner(SourceText source, Span contents) {
        this.lexer = new FormatLexer(source, contents);
        this.contents = contents;
        this.before = Span.empty(contents.start());
        this.remainderStart = contents.start();
    }

    /**
     * Returns the next specifier, or null once the format string is exhausted.
     */
    public Specifier next() {
        FormatToken token;
        while ((token = lexer.next()) != null) {
            if (token.isSpecifier()) {
                before = new Span(remainderStart, token.start());
                remainderStart = token.end();
                return new Specifier(token.span(), token.options(), token.type());
            }
        }
        return null;
    }

    /**
     * Literal text immediately preceding the specifier last returned by {@link #next()}.
     */
    public Span before() {
        return before;
    }

    /**
     * Literal text after the specifier last returned by {@link #next()}; once the scanner is
     * exhausted, the text after the last specifier.
     */
    public Span remainder() {
        return new Span(remainderStart, contents.end());
    }

    /**
     * Consumes the remaining specifiers and returns how many there were.
     */
    public int count() {
        int count = 0;
        while (next() != null) {
            count++;
        }
        return count;
    }
}
