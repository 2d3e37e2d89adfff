package org.fmtguard;

import org.fmtguard.core.Configuration;
import org.fmtguard.diagnostics.DiagnosticReporter;
import org.fmtguard.diagnostics.JsonDiagnostics;
import org.fmtguard.diagnostics.SourceErrors;
import org.fmtguard.ir.IntermediateRepresentation;
import org.fmtguard.ir.IrRenderer;
import org.fmtguard.ir.ParseResult;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;

/**
 * Command-line entry point: validates one C file and optionally writes its optimized and
 * type-cast renderings.
 * <p>
 * Output files are never overwritten. Exit status is 0 when every call validated, 1 when the
 * file has errors, 2 for a bad command line and 3 when a file cannot be read or written.
 */
public class FmtGuard {

    private final PrintStream out;
    private final PrintStream err;
    private final InputStream in;

    public FmtGuard(PrintStream out, PrintStream err, InputStream in) {
        this.out = out;
        this.err = err;
        this.in = in;
    }

    public static void main(String[] args) {
        int status = new FmtGuard(System.out, System.err, System.in).run(args);
        System.exit(status);
    }

    /**
     * Runs the checker with the given command line and returns the exit status.
     */
    public int run(String[] args) {
        ArgumentParser.CheckerOptions options;
        try {
            options = ArgumentParser.parseArguments(args);
        } catch (UsageException e) {
            err.println("Error: " + e.getMessage());
            err.print(ArgumentParser.usage());
            return Configuration.EXIT_USAGE;
        }

        if (options.help) {
            out.print(ArgumentParser.usage());
            return Configuration.EXIT_OK;
        }
        if (options.version) {
            out.println(Configuration.getVersionString());
            return Configuration.EXIT_OK;
        }

        try {
            return check(options);
        } catch (UncheckedIOException e) {
            err.println("Error: " + e.getMessage());
            return Configuration.EXIT_IO;
        }
    }

    private int check(ArgumentParser.CheckerOptions options) {
        String source = readSource(options.fileName);
        if (options.debug) {
            err.println("DEBUG: read " + source.length() + " characters from " + options.fileName);
        }

        ParseResult result = IntermediateRepresentation.parse(source);
        try {
            IntermediateRepresentation ir = result.orElseThrow(options.fileName, source);
            if (options.debug) {
                err.println("DEBUG: validated " + ir.sites().size() + " call sites");
            }
            if (options.optimizePath != null) {
                write(ir.displayOptimize(), "optimize", options.optimizePath, options.debug);
            }
            if (options.typecastPath != null) {
                write(ir.displayTypecast(), "typecast", options.typecastPath, options.debug);
            }
            return Configuration.EXIT_OK;
        } catch (SourceErrors e) {
            if (options.debug) {
                err.println("DEBUG: found " + e.getErrors().size() + " errors");
            }
            if (options.json) {
                out.println(JsonDiagnostics.encode(e, true));
            } else {
                err.print(DiagnosticReporter.render(e));
            }
            return Configuration.EXIT_SOURCE_ERRORS;
        }
    }

    private String readSource(String fileName) {
        try {
            if (fileName.equals("-")) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
            return Files.readString(Paths.get(fileName), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("failed reading input at " + fileName, e);
        }
    }

    private void write(IrRenderer renderer, String kind, Path path, boolean debug) {
        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
            writer.write(renderer.render());
            writer.write('\n');
        } catch (IOException e) {
            throw new UncheckedIOException("Failed writing output for --" + kind + ": " + path, e);
        }
        if (debug) {
            err.println("DEBUG: wrote --" + kind + " output to " + path);
        }
    }
}
