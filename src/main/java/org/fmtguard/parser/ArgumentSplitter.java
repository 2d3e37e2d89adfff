package org.fmtguard.parser;

import org.fmtguard.diagnostics.FormatError;
import org.fmtguard.lexer.ArgLexer;
import org.fmtguard.lexer.ArgToken;
import org.fmtguard.lexer.SourceLexer;
import org.fmtguard.lexer.Span;

import java.util.List;

/**
 * Splits the argument list of a call into top-level arguments.
 * <p>
 * Scanning starts where the source lexer stands, right after the call's opening parenthesis.
 * Commas inside nested parentheses, character literals and string literals do not split an
 * argument. When the closing parenthesis is reached, the source lexer is moved just past it so
 * that source-level scanning resumes exactly where the call ends.
 * <p>
 * Example:
 * <pre>
 * snprintf(buffer, bufsz, "Total: $%d", (cost + fee) * tax);
 * //      ^                                               ^
 * //      source lexer stands here                        and ends up here
 * </pre>
 */
public class ArgumentSplitter {

    private final SourceLexer sourceLexer;
    private final ArgLexer lexer;
    private final int start;
    private int end;
    private boolean hasRemaining = true;
    private int emitted;

    public ArgumentSplitter(SourceLexer sourceLexer) {
        this.sourceLexer = sourceLexer;
        this.start = sourceLexer.getPosition();
        this.end = start;
        this.lexer = new ArgLexer(sourceLexer.getSource(), start);
    }

    /**
     * Returns the next argument, or null after the last one.
     * <p>
     * {@code f()} has no arguments; in any other list every comma-separated piece is an
     * argument, with an empty span if it holds nothing. A list cut off by the end of input
     * yields no further arguments.
     */
    public Arg next() {
        if (!hasRemaining) {
            return null;
        }

        Arg.Cast cast = null;
        Span span = null;
        int depth = 0;
        ArgToken single = null;
        int count = 0;

        while (true) {
            ArgToken token = lexer.next();
            if (token == null) {
                hasRemaining = false;
                sourceLexer.reset(lexer.getPosition());
                return null;
            }

            switch (token.type()) {
                case COMMA:
                    if (depth == 0) {
                        return finish(single, count, span == null ? Span.empty(token.start()) : span, cast);
                    }
                    break;
                case LPAREN:
                    depth++;
                    break;
                case RPAREN:
                    if (depth > 0) {
                        depth--;
                        break;
                    }
                    // closes the call
                    hasRemaining = false;
                    end = token.start();
                    sourceLexer.reset(token.end());
                    if (span == null && emitted == 0) {
                        return null;
                    }
                    return finish(single, count, span == null ? Span.empty(token.start()) : span, cast);
                case COMMENT:
                    break;
                case TYPE_CAST:
                    if (cast == null && count == 0) {
                        cast = new Arg.Cast(token.castType(), token.span());
                        break;
                    }
                    // a later cast is ordinary content
                default:
                    single = count == 0 ? token : null;
                    count++;
                    break;
            }

            span = Span.union(span, token.span());
            end = token.end();
        }
    }

    private Arg finish(ArgToken single, int count, Span span, Arg.Cast cast) {
        emitted++;
        return new Arg(count == 1 ? single : null, span, cast);
    }

    /**
     * Consumes the remaining arguments, returning how many there were and the span of the
     * whole argument list.
     */
    public ArgSummary shortCircuit() {
        int remaining = 0;
        while (next() != null) {
            remaining++;
        }
        return new ArgSummary(remaining, new Span(start, end));
    }

    /**
     * Reads the next argument as a format string literal.
     *
     * @param errors receives {@link FormatError.MissingFunctionArgs} if there is no argument left,
     *               or {@link FormatError.NonliteralFormat} if the argument is not a string literal
     * @return the format string, or null if an error was recorded
     */
    public FormatString nextFormatString(List<FormatError> errors) {
        Arg arg = next();
        if (arg == null) {
            errors.add(new FormatError.MissingFunctionArgs(new Span(start, end)));
            return null;
        }
        if (arg.isStringLiteral()) {
            return new FormatString(arg.span(), arg.singleToken().contents());
        }
        String identifier = arg.isIdentifier() ? sourceLexer.getSource().slice(arg.singleToken().span()) : null;
        errors.add(new FormatError.NonliteralFormat(arg.span(), identifier));
        return null;
    }
}
