package org.fmtguard.diagnostics;

import org.fmtguard.lexer.Span;

/**
 * A piece of source text pointed at by a diagnostic, with the text shown next to it.
 */
public record Label(Span span, String text) {
}
