package org.fmtguard.diagnostics;

/**
 * The closed set of problems a call site can have.
 */
public enum ErrorKind {
    MISSING_FUNCTION_ARGS("Missing function arguments."),
    NONLITERAL_FORMAT("Format string isn't a string literal, this is potentially an overflow vulnerability!"),
    SPECIFIER_CAST_MISMATCH("Incorrect specifier for type casted argument."),
    EXCESS_SPECIFIERS("Excess specifiers, this will read arbitrary data off the stack!"),
    EXCESS_ARGS("Excess arguments.");

    private final String message;

    ErrorKind(String message) {
        this.message = message;
    }

    public String message() {
        return message;
    }
}
