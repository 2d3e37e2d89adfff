package org.fmtguard.diagnostics;

import org.fmtguard.ir.CType;
import org.fmtguard.lexer.Span;

import java.util.List;

/**
 * A problem found at a call site.
 * <p>
 * Errors are plain values: they are collected while scanning and never thrown on their own.
 * Each one locates itself in the source with one or more {@link Label}s and carries a
 * remediation hint.
 */
public interface FormatError {

    ErrorKind kind();

    List<Label> labels();

    /**
     * Remediation text, or null if there is none.
     */
    String help();

    default String message() {
        return kind().message();
    }

    /**
     * Fewer arguments than the function needs before and including its format string.
     *
     * @param span the argument list, empty for {@code printf()}
     */
    record MissingFunctionArgs(Span span) implements FormatError {
        @Override
        public ErrorKind kind() {
            return ErrorKind.MISSING_FUNCTION_ARGS;
        }

        @Override
        public List<Label> labels() {
            return List.of(new Label(span, "not enough arguments in function call"));
        }

        @Override
        public String help() {
            return "Supply enough arguments for the function call.";
        }
    }

    /**
     * The format argument is not a string literal.
     *
     * @param span       the format argument
     * @param identifier the argument's text when it is a single identifier, otherwise null
     */
    record NonliteralFormat(Span span, String identifier) implements FormatError {
        @Override
        public ErrorKind kind() {
            return ErrorKind.NONLITERAL_FORMAT;
        }

        @Override
        public List<Label> labels() {
            return List.of(new Label(span, "not a string literal"));
        }

        @Override
        public String help() {
            if (identifier != null) {
                return "To safely print a string, use `printf(\"%s\", " + identifier + ")` instead.";
            }
            return "Use a string literal as the first argument, like `printf(\"hello\")`.";
        }
    }

    /**
     * An argument is cast to a different type than its specifier converts.
     */
    record SpecifierCastMismatch(Span specifierSpan, CType specifierType, Span castSpan, CType castType)
            implements FormatError {
        @Override
        public ErrorKind kind() {
            return ErrorKind.SPECIFIER_CAST_MISMATCH;
        }

        @Override
        public List<Label> labels() {
            return List.of(
                    new Label(specifierSpan, "format string expects `" + specifierType + "` value"),
                    new Label(castSpan, "argument is casted as `" + castType + "`"));
        }

        @Override
        public String help() {
            return "Change the specifier to `%" + castType.specifierChar()
                    + "`, or change the cast to `(" + specifierType + ")`.";
        }
    }

    /**
     * The format string has more specifiers than there are arguments.
     */
    record ExcessSpecifiers(Span formatSpan, Span argsSpan, int additionalSpecifiers) implements FormatError {
        @Override
        public ErrorKind kind() {
            return ErrorKind.EXCESS_SPECIFIERS;
        }

        @Override
        public List<Label> labels() {
            return List.of(
                    new Label(formatSpan, additionalSpecifiers + " too many specifiers"),
                    new Label(argsSpan, "not enough arguments"));
        }

        @Override
        public String help() {
            if (additionalSpecifiers == 1) {
                return "Add an argument or remove a specifier.";
            }
            return "Add " + additionalSpecifiers + " arguments or remove " + additionalSpecifiers + " specifiers.";
        }
    }

    /**
     * There are more arguments than the format string has specifiers.
     */
    record ExcessArgs(Span formatSpan, Span argsSpan, int additionalArgs) implements FormatError {
        @Override
        public ErrorKind kind() {
            return ErrorKind.EXCESS_ARGS;
        }

        @Override
        public List<Label> labels() {
            return List.of(
                    new Label(formatSpan, "not enough specifiers"),
                    new Label(argsSpan, additionalArgs + " too many arguments"));
        }

        @Override
        public String help() {
            if (additionalArgs == 1) {
                return "Add a specifier or remove an argument.";
            }
            return "Add " + additionalArgs + " specifiers or remove " + additionalArgs + " arguments.";
        }
    }
}
