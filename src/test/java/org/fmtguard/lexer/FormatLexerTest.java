package org.fmtguard.lexer;

import org.fmtguard.ir.CType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class FormatLexerTest {

    private static List<FormatToken> tokenize(String contents) {
        FormatLexer lexer = new FormatLexer(new SourceText(contents), new Span(0, contents.length()));
        List<FormatToken> tokens = new ArrayList<>();
        FormatToken token;
        while ((token = lexer.next()) != null) {
            tokens.add(token);
        }
        return tokens;
    }

    @Test
    public void testSpecifiersAndText() {
        List<FormatToken> tokens = tokenize("a%-5.2f%%%s\\n%q%i");
        assertEquals(List.of(
                FormatToken.normal(new Span(0, 1)),
                new FormatToken(new Span(1, 7), new Span(2, 6), CType.FLOAT),
                FormatToken.normal(new Span(7, 9)),
                new FormatToken(new Span(9, 11), new Span(10, 10), CType.STRING),
                FormatToken.normal(new Span(11, 13)),
                FormatToken.normal(new Span(13, 14)),
                FormatToken.normal(new Span(14, 15)),
                new FormatToken(new Span(15, 17), new Span(16, 16), CType.INT)), tokens);
    }

    @Test
    public void testWidthAndPrecisionForms() {
        assertEquals(new Span(1, 2), tokenize("%5d").get(0).options());
        assertEquals(new Span(1, 3), tokenize("%.3f").get(0).options());
        assertEquals(new Span(1, 4), tokenize("%+4.s").get(0).options());
        assertEquals(CType.STRING, tokenize("%+4.s").get(0).type());
    }

    @Test
    public void testUnsupportedConversionsAreText() {
        for (FormatToken token : tokenize("%ld %x %5")) {
            assertFalse(token.isSpecifier(), token.toString());
        }
    }

    @Test
    public void testEscapedPercentIsText() {
        List<FormatToken> tokens = tokenize("\\%d");
        assertEquals(FormatToken.normal(new Span(0, 2)), tokens.get(0));
        assertEquals(2, tokens.size());
        assertFalse(tokens.get(1).isSpecifier());
    }

    @Test
    public void testStaysInsideContents() {
        SourceText source = new SourceText("printf(\"%d\", %s)");
        FormatLexer lexer = new FormatLexer(source, new Span(8, 10));
        FormatToken token = lexer.next();
        assertEquals(new FormatToken(new Span(8, 10), new Span(9, 9), CType.INT), token);
        assertNull(lexer.next());
    }

    @Test
    public void testTrailingBackslash() {
        List<FormatToken> tokens = tokenize("a\\");
        assertEquals(FormatToken.normal(new Span(1, 2)), tokens.get(1));
    }
}
