package org.fmtguard.diagnostics;

import org.fmtguard.ir.IntermediateRepresentation;
import org.fmtguard.lexer.SourceText;
import org.fmtguard.lexer.Span;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class DiagnosticReporterTest {

    private static SourceErrors errors(String fileName, String code) {
        return assertThrows(SourceErrors.class,
                () -> IntermediateRepresentation.parse(code).orElseThrow(fileName, code));
    }

    @Test
    public void testCastMismatchReport() {
        String expected = "Error: Source code contains errors.\n"
                + "\n"
                + "error: Incorrect specifier for type casted argument.\n"
                + " --> main.c:1:9\n"
                + "  |\n"
                + "1 | printf(\"%d\", (float) x);\n"
                + "  |         ^^ format string expects `int` value\n"
                + "  |              ^^^^^^^ argument is casted as `float`\n"
                + "  = help: Change the specifier to `%f`, or change the cast to `(int)`.\n";
        assertEquals(expected, DiagnosticReporter.render(errors("main.c", "printf(\"%d\", (float) x);")));
    }

    @Test
    public void testTabsAreKeptUnderTheLine() {
        SourceText source = new SourceText("\tprintf(x);");
        StringBuilder sb = new StringBuilder();
        new DiagnosticReporter("t.c", source).render(sb, new FormatError.NonliteralFormat(new Span(8, 9), "x"));
        String expected = "error: Format string isn't a string literal, this is potentially an overflow vulnerability!\n"
                + " --> t.c:1:9\n"
                + "  |\n"
                + "1 | \tprintf(x);\n"
                + "  | \t       ^ not a string literal\n"
                + "  = help: To safely print a string, use `printf(\"%s\", x)` instead.\n";
        assertEquals(expected, sb.toString());
    }

    @Test
    public void testLabelsOnSeveralLines() {
        String code = "\n\n\n\n\n\n\n\n\nprintf(\"%d\",\n       (float) a);\n";
        String expected = "error: Incorrect specifier for type casted argument.\n"
                + "  --> long.c:10:9\n"
                + "   |\n"
                + "10 | printf(\"%d\",\n"
                + "   |         ^^ format string expects `int` value\n"
                + "11 |        (float) a);\n"
                + "   |        ^^^^^^^ argument is casted as `float`\n"
                + "   = help: Change the specifier to `%f`, or change the cast to `(int)`.\n";
        String report = DiagnosticReporter.render(errors("long.c", code));
        assertTrue(report.endsWith(expected), report);
    }

    @Test
    public void testEmptySpanGetsOneCaret() {
        String report = DiagnosticReporter.render(errors("e.c", "printf();"));
        assertTrue(report.contains("1 | printf();\n  |        ^ not enough arguments in function call\n"), report);
    }

    @Test
    public void testErrorsKeepSource() {
        SourceErrors errors = errors("x.c", "printf(y);");
        assertEquals("x.c", errors.getFileName());
        assertEquals("printf(y);", errors.getSource().text());
        assertEquals(1, errors.getErrors().size());
        assertEquals("Source code contains errors.", errors.getMessage());
    }
}
