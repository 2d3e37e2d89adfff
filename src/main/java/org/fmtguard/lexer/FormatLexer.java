package org.fmtguard.lexer;

import org.fmtguard.ir.CType;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tokenizer for the contents of a format string literal.
 * <p>
 * Recognized conversions are {@code %d}, {@code %i}, {@code %f} and {@code %s}, each with an
 * optional signed width and precision such as {@code %-10.3f}. A backslash escape and {@code %%}
 * are consumed as one piece of normal text so that they cannot start a conversion. Anything
 * else, including conversions with other letters or length modifiers, is normal text.
 */
public class FormatLexer extends CLexer {

    private static final Pattern SPECIFIER = Pattern.compile(
            "%([+-]?(?:[0-9]+(?:\\.[0-9]*)?|\\.[0-9]+))?([difs])");

    private final Matcher matcher;

    /**
     * Creates a lexer over the characters of {@code contents}, the text between the quotes.
     */
    public FormatLexer(SourceText source, Span contents) {
        super(source, contents.start(), contents.end());
        this.matcher = SPECIFIER.matcher(input);
    }

    /**
     * Returns the next token, or null at the end of the format string.
     */
    public FormatToken next() {
        if (isAtEnd()) {
            return null;
        }
        tokenStart = position;
        char c = peek();

        if (c == '\\') {
            position = Math.min(position + 2, limit);
            return FormatToken.normal(tokenSpan());
        }
        if (c == '%') {
            if (peekAhead(1) == '%') {
                position += 2;
                return FormatToken.normal(tokenSpan());
            }
            matcher.region(position, limit);
            if (matcher.lookingAt()) {
                position = matcher.end();
                Span options = matcher.group(1) == null
                        ? Span.empty(tokenStart + 1)
                        : new Span(matcher.start(1), matcher.end(1));
                return new FormatToken(tokenSpan(), options, conversionType(matcher.group(2).charAt(0)));
            }
        }
        advanceCodePoint();
        return FormatToken.normal(tokenSpan());
    }

    private static CType conversionType(char conversion) {
        return switch (conversion) {
            case 'd', 'i' -> CType.INT;
            case 'f' -> CType.FLOAT;
            case 's' -> CType.STRING;
            default -> throw new IllegalStateException("Unexpected conversion " + conversion);
        };
    }
}
