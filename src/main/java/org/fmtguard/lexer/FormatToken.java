package org.fmtguard.lexer;

import org.fmtguard.ir.CType;

/**
 * A token of the format-string grammar: either a recognized conversion specifier or a piece
 * of normal text.
 *
 * @param span    the extent of the token within the source
 * @param options for a specifier, the flags/width/precision between {@code %} and the conversion
 *                letter (possibly empty); null for normal text
 * @param type    for a specifier, the value type it converts; null for normal text
 */
public record FormatToken(Span span, Span options, CType type) {

    public static FormatToken normal(Span span) {
        return new FormatToken(span, null, null);
    }

    public boolean isSpecifier() {
        return type != null;
    }

    public int start() {
        return span.start();
    }

    public int end() {
        return span.end();
    }
}
