package org.fmtguard.ir;

import org.fmtguard.diagnostics.FormatError;
import org.fmtguard.diagnostics.SourceErrors;

import java.util.List;

/**
 * Outcome of parsing a file: either a complete intermediate representation or the non-empty
 * list of errors found across all call sites, never both.
 */
public record ParseResult(IntermediateRepresentation ir, List<FormatError> errors) {

    public ParseResult {
        if ((ir == null) == (errors == null || errors.isEmpty())) {
            throw new IllegalArgumentException("Exactly one of ir or errors must be present");
        }
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static ParseResult success(IntermediateRepresentation ir) {
        return new ParseResult(ir, null);
    }

    public static ParseResult failure(List<FormatError> errors) {
        return new ParseResult(null, errors);
    }

    public boolean isSuccess() {
        return ir != null;
    }

    /**
     * Returns the representation, or throws the errors bundled with the source they refer to.
     *
     * @param fileName name used when reporting the errors
     * @throws SourceErrors if parsing failed
     */
    public IntermediateRepresentation orElseThrow(String fileName, String source) {
        if (ir != null) {
            return ir;
        }
        throw new SourceErrors(fileName, source, errors);
    }
}
