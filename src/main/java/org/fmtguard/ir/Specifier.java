package org.fmtguard.ir;

import org.fmtguard.lexer.Span;

/**
 * A conversion specifier in a format string.
 *
 * @param span    the whole directive, e.g. {@code %-2.3f}
 * @param options the {@code -2.3} part, possibly empty
 * @param type    the C type corresponding to the conversion letter
 */
public record Specifier(Span span, Span options, CType type) {
}
