package org.fmtguard.parser;

import org.fmtguard.diagnostics.FormatError;
import org.fmtguard.ir.CType;
import org.fmtguard.ir.FormatValue;
import org.fmtguard.ir.Interpolation;
import org.fmtguard.lexer.SourceLexer;
import org.fmtguard.lexer.SourceText;
import org.fmtguard.lexer.Span;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class FormatMatcherTest {

    private final List<FormatError> errors = new ArrayList<>();

    /**
     * Matches the arguments of a {@code printf} call written as {@code code}.
     */
    private Interpolation<FormatValue> match(String code) {
        SourceText source = new SourceText(code);
        SourceLexer lexer = new SourceLexer(source);
        lexer.reset(code.indexOf('(') + 1);
        ArgumentSplitter args = new ArgumentSplitter(lexer);
        FormatString format = args.nextFormatString(errors);
        assertNotNull(format, "format string");
        return FormatMatcher.match(format, new SpecifierScanner(source, format.contents()), args, errors);
    }

    @Test
    public void testStep() {
        assertEquals(FormatMatcher.Step.NEITHER, FormatMatcher.Step.of(null, null));
        Arg arg = new Arg(null, Span.empty(0), null);
        assertEquals(FormatMatcher.Step.ARGUMENT_ONLY, FormatMatcher.Step.of(null, arg));
    }

    @Test
    public void testUncastArgumentsAlwaysMatch() {
        Interpolation<FormatValue> values = match("printf(\"%d %f %s!\", s, i, f)");
        assertTrue(errors.isEmpty());
        assertEquals(3, values.size());
        assertEquals(CType.FLOAT, values.entries().get(1).value().type());
        assertFalse(values.entries().get(1).value().typeChecked());
        assertEquals(new Span(10, 11), values.entries().get(1).chunk());
        assertEquals(new Span(16, 17), values.last());
    }

    @Test
    public void testMatchingCastIsTypeChecked() {
        Interpolation<FormatValue> values = match("printf(\"%s\", (char*) p)");
        FormatValue value = values.entries().get(0).value();
        assertTrue(value.typeChecked());
        assertEquals(new Span(13, 22), value.arg());
    }

    @Test
    public void testExcessArgs() {
        assertNull(match("printf(\"%d\", a, b, c);"));
        assertEquals(List.of(new FormatError.ExcessArgs(new Span(7, 11), new Span(7, 20), 2)), errors);
    }

    @Test
    public void testExcessSpecifiers() {
        assertNull(match("printf(\"%d %d %s\", a);"));
        assertEquals(List.of(new FormatError.ExcessSpecifiers(new Span(7, 17), new Span(7, 20), 2)), errors);
        assertEquals("Add 2 arguments or remove 2 specifiers.", errors.get(0).help());
    }

    @Test
    public void testEveryCastMismatchIsReported() {
        assertNull(match("printf(\"%d %s\", (float) x, (int) y)"));
        assertEquals(2, errors.size());
        FormatError.SpecifierCastMismatch first = (FormatError.SpecifierCastMismatch) errors.get(0);
        assertEquals(CType.INT, first.specifierType());
        assertEquals(CType.FLOAT, first.castType());
        assertEquals(new Span(8, 10), first.specifierSpan());
        assertEquals(new Span(16, 23), first.castSpan());
        assertEquals(CType.STRING, ((FormatError.SpecifierCastMismatch) errors.get(1)).specifierType());
    }

    @Test
    public void testCountMismatchAfterCastMismatch() {
        assertNull(match("printf(\"%d\", (float) x, y)"));
        assertEquals(2, errors.size());
        assertInstanceOf(FormatError.SpecifierCastMismatch.class, errors.get(0));
        assertInstanceOf(FormatError.ExcessArgs.class, errors.get(1));
    }
}
