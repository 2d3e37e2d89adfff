package org.fmtguard.ir;

import org.fmtguard.lexer.SourceTokenType;

/**
 * The formatting functions whose call sites are checked.
 */
public enum FormatFunction {
    PRINTF("printf", 0),
    SPRINTF("sprintf", 1),
    SNPRINTF("snprintf", 2);

    private final String functionName;
    private final int leadingArgs;

    FormatFunction(String functionName, int leadingArgs) {
        this.functionName = functionName;
        this.leadingArgs = leadingArgs;
    }

    public String functionName() {
        return functionName;
    }

    /**
     * Number of arguments that precede the format string: the buffer for {@code sprintf},
     * the buffer and its size for {@code snprintf}.
     */
    public int leadingArgs() {
        return leadingArgs;
    }

    /**
     * Name of the fixed-arity replacement used in optimized output.
     */
    public String safeName() {
        return "safe_" + functionName;
    }

    public SourceTokenType sourceTokenType() {
        return switch (this) {
            case PRINTF -> SourceTokenType.PRINTF;
            case SPRINTF -> SourceTokenType.SPRINTF;
            case SNPRINTF -> SourceTokenType.SNPRINTF;
        };
    }
}
