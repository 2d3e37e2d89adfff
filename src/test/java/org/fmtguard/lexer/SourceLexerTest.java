package org.fmtguard.lexer;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SourceLexerTest {

    private static List<SourceToken> tokenize(String code) {
        SourceLexer lexer = new SourceLexer(new SourceText(code));
        List<SourceToken> tokens = new ArrayList<>();
        SourceToken token;
        while ((token = lexer.next()) != null) {
            tokens.add(token);
        }
        return tokens;
    }

    private static List<SourceTokenType> types(String code) {
        List<SourceTokenType> types = new ArrayList<>();
        for (SourceToken token : tokenize(code)) {
            types.add(token.type());
        }
        return types;
    }

    @Test
    public void testSimpleCall() {
        List<SourceToken> tokens = tokenize("printf(\"a\");");
        assertEquals(List.of(
                new SourceToken(SourceTokenType.PRINTF, new Span(0, 6)),
                new SourceToken(SourceTokenType.LPAREN, new Span(6, 7)),
                new SourceToken(SourceTokenType.STRING, new Span(7, 10)),
                new SourceToken(SourceTokenType.RPAREN, new Span(10, 11)),
                new SourceToken(SourceTokenType.OTHER, new Span(11, 12))), tokens);
    }

    @Test
    public void testTrackedNamesRequireExactMatch() {
        assertEquals(List.of(SourceTokenType.SPRINTF, SourceTokenType.SNPRINTF, SourceTokenType.OTHER,
                        SourceTokenType.OTHER, SourceTokenType.OTHER),
                types("sprintf snprintf printf_wrapper my_printf fprintf"));
    }

    @Test
    public void testCommentsHideCalls() {
        assertEquals(List.of(SourceTokenType.COMMENT, SourceTokenType.COMMENT, SourceTokenType.OTHER),
                types("// printf(\"x\")\n/* printf(\"y\") */ x"));
    }

    @Test
    public void testStringsHideCalls() {
        assertEquals(List.of(SourceTokenType.STRING, SourceTokenType.PRINTF),
                types("\"printf(\\\"hello\\\")\" printf"));
    }

    @Test
    public void testAdjacentStringsAreOneToken() {
        List<SourceToken> tokens = tokenize("\"a\"  \"b\" ;");
        assertEquals(new SourceToken(SourceTokenType.STRING, new Span(0, 8)), tokens.get(0));
        assertEquals(2, tokens.size());
    }

    @Test
    public void testPrefixedString() {
        assertEquals(List.of(SourceTokenType.STRING, SourceTokenType.OTHER, SourceTokenType.STRING, SourceTokenType.OTHER),
                types("L\"wide\" x u8\"utf\" L"));
    }

    @Test
    public void testCharLiteralDoesNotOpenString() {
        List<SourceToken> tokens = tokenize("'\"' printf");
        assertEquals(new SourceToken(SourceTokenType.OTHER, new Span(0, 3)), tokens.get(0));
        assertEquals(SourceTokenType.PRINTF, tokens.get(1).type());
    }

    @Test
    public void testNumberIsOneToken() {
        List<SourceToken> tokens = tokenize("1e+5f printf");
        assertEquals(new SourceToken(SourceTokenType.OTHER, new Span(0, 5)), tokens.get(0));
        assertEquals(SourceTokenType.PRINTF, tokens.get(1).type());
    }

    @Test
    public void testUnterminatedBlockComment() {
        List<SourceToken> tokens = tokenize("/* printf");
        assertEquals(new SourceToken(SourceTokenType.OTHER, new Span(0, 1)), tokens.get(0));
        assertEquals(SourceTokenType.PRINTF, tokens.get(tokens.size() - 1).type());
    }

    @Test
    public void testUnicodeIdentifier() {
        assertEquals(List.of(SourceTokenType.OTHER, SourceTokenType.PRINTF), types("größe printf"));
        assertEquals(1, tokenize("printfé").size());
    }

    @Test
    public void testResetRewindsLexer() {
        SourceLexer lexer = new SourceLexer(new SourceText("printf x"));
        lexer.next();
        int afterName = lexer.getPosition();
        assertEquals(6, afterName);
        lexer.next();
        lexer.reset(afterName);
        assertEquals(new SourceToken(SourceTokenType.OTHER, new Span(7, 8)), lexer.next());
        assertNull(lexer.next());
    }
}
