package org.fmtguard.parser;

import org.fmtguard.lexer.Span;

/**
 * The string literal passed as a format.
 *
 * @param literal  the literal including its quotes
 * @param contents the text between the quotes
 */
public record FormatString(Span literal, Span contents) {
}
