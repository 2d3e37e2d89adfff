package org.fmtguard.parser;

import org.fmtguard.lexer.Span;

/**
 * Result of draining an argument list without inspecting the individual arguments.
 *
 * @param count number of arguments that were left
 * @param span  the whole argument list, from after the opening to before the closing parenthesis
 */
public record ArgSummary(int count, Span span) {
}
