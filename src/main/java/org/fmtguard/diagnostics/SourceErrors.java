package org.fmtguard.diagnostics;

import org.fmtguard.lexer.SourceText;

import java.io.Serial;
import java.util.List;

/**
 * Every error found in one file, bundled with the file name and source they refer to.
 * <p>
 * This is all a presentation layer needs: see {@link DiagnosticReporter} for a plain-text
 * rendering and {@link JsonDiagnostics} for a machine-readable one.
 */
public class SourceErrors extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 1L;

    private final String fileName;
    private final transient SourceText source;
    private final transient List<FormatError> errors;

    public SourceErrors(String fileName, String source, List<FormatError> errors) {
        this(fileName, new SourceText(source), errors);
    }

    public SourceErrors(String fileName, SourceText source, List<FormatError> errors) {
        super("Source code contains errors.");
        this.fileName = fileName;
        this.source = source;
        this.errors = List.copyOf(errors);
    }

    public String getFileName() {
        return fileName;
    }

    public SourceText getSource() {
        return source;
    }

    public List<FormatError> getErrors() {
        return errors;
    }
}
