package org.fmtguard.diagnostics;

import org.fmtguard.lexer.SourceText;
import org.fmtguard.lexer.Span;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Renders {@link SourceErrors} as plain text with the offending source lines and carets
 * under each labeled span:
 * <pre>
 * error: Incorrect specifier for type casted argument.
 *  --&gt; main.c:4:13
 *   |
 * 4 |     printf("%d", (float) x);
 *   |             ^^ format string expects `int` value
 *   |                  ^^^^^^^ argument is casted as `float`
 *   = help: Change the specifier to `%f`, or change the cast to `(int)`.
 * </pre>
 */
public class DiagnosticReporter {

    private final String fileName;
    private final SourceText source;
    private final int gutterWidth;

    public DiagnosticReporter(String fileName, SourceText source) {
        this.fileName = fileName;
        this.source = source;
        this.gutterWidth = Integer.toString(source.lineCount()).length();
    }

    /**
     * Renders all errors of the bundle, preceded by its summary line.
     */
    public static String render(SourceErrors errors) {
        DiagnosticReporter reporter = new DiagnosticReporter(errors.getFileName(), errors.getSource());
        StringBuilder sb = new StringBuilder();
        sb.append("Error: ").append(errors.getMessage()).append('\n');
        for (FormatError error : errors.getErrors()) {
            sb.append('\n');
            reporter.render(sb, error);
        }
        return sb.toString();
    }

    public void render(StringBuilder sb, FormatError error) {
        sb.append("error: ").append(error.message()).append('\n');

        List<Label> labels = error.labels();
        int firstOffset = labels.get(0).span().start();
        pad(sb, gutterWidth);
        sb.append("--> ").append(fileName).append(':')
                .append(source.lineNumber(firstOffset)).append(':')
                .append(source.columnNumber(firstOffset)).append('\n');
        gutter(sb, "");
        sb.append('\n');

        // labels grouped by the line they start on, in source order
        Map<Integer, List<Label>> byLine = new TreeMap<>();
        for (Label label : labels) {
            byLine.computeIfAbsent(source.lineNumber(label.span().start()), k -> new ArrayList<>()).add(label);
        }
        for (Map.Entry<Integer, List<Label>> entry : byLine.entrySet()) {
            int line = entry.getKey();
            Span lineSpan = source.lineSpan(line);
            gutter(sb, Integer.toString(line));
            sb.append(' ').append(source.slice(lineSpan)).append('\n');
            List<Label> lineLabels = entry.getValue();
            lineLabels.sort((a, b) -> Integer.compare(a.span().start(), b.span().start()));
            for (Label label : lineLabels) {
                gutter(sb, "");
                sb.append(' ');
                underline(sb, lineSpan, label.span());
                sb.append(' ').append(label.text()).append('\n');
            }
        }

        String help = error.help();
        if (help != null) {
            pad(sb, gutterWidth + 1);
            sb.append("= help: ").append(help).append('\n');
        }
    }

    private void underline(StringBuilder sb, Span lineSpan, Span span) {
        // keep tabs so the carets line up with the source line above
        for (int i = lineSpan.start(); i < span.start(); i++) {
            char c = source.charAt(i);
            if (c == '\t') {
                sb.append('\t');
            } else if (!Character.isLowSurrogate(c)) {
                sb.append(' ');
            }
        }
        int end = Math.min(span.end(), lineSpan.end());
        int width = Math.max(1, source.text().codePointCount(span.start(), Math.max(span.start(), end)));
        sb.append("^".repeat(width));
    }

    private void gutter(StringBuilder sb, String lineNumber) {
        pad(sb, gutterWidth - lineNumber.length());
        sb.append(lineNumber).append(" |");
    }

    private static void pad(StringBuilder sb, int count) {
        sb.append(" ".repeat(Math.max(0, count)));
    }
}
