package org.fmtguard.ir;

import org.fmtguard.lexer.Span;

/**
 * Pairing between an argument to be printed and the specifier that tells how to print it.
 *
 * @param specifier   the specifier, e.g. {@code %10s}
 * @param arg         the argument expression, e.g. {@code name}
 * @param typeChecked whether the argument was explicitly cast to the type the specifier expects
 */
public record FormatValue(Specifier specifier, Span arg, boolean typeChecked) {

    public CType type() {
        return specifier.type();
    }
}
