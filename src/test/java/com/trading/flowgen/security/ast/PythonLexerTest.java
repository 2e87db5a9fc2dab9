package com.trading.flowgen.security.ast;

import com.trading.flowgen.security.SourceSyntaxException;
import org.junit.Test;

import java.util.List;

import static com.trading.flowgen.security.ast.TokenType.*;
import static org.junit.Assert.*;

public class PythonLexerTest {

    private static List<TokenType> types(String src) {
        return new PythonLexer(src).tokenize().stream().map(Token::type).toList();
    }

    private static SourceSyntaxException fails(String src) {
        try {
            new PythonLexer(src).tokenize();
        } catch (SourceSyntaxException e) {
            return e;
        }
        fail("Expected a syntax error for: " + src);
        return null;
    }

    @Test
    public void testIndentation() {
        assertEquals(List.of(NAME, NAME, OP, NEWLINE, INDENT, NAME, OP, NUMBER, NEWLINE, DEDENT, ENDMARKER),
                types("if x:\n    y = 1\n"));
    }

    @Test
    public void testCommentsAndBlankLines() {
        assertEquals(List.of(NAME, OP, NUMBER, NEWLINE, NAME, OP, NUMBER, NEWLINE, ENDMARKER),
                types("x = 1  # note\n\n# full line\ny = 2"));
    }

    @Test
    public void testNewlinesInsideBrackets() {
        assertEquals(List.of(NAME, OP, OP, NUMBER, OP, NUMBER, OP, NEWLINE, ENDMARKER),
                types("x = (1,\n     2)\n"));
    }

    @Test
    public void testLineContinuation() {
        assertEquals(List.of(NAME, OP, NUMBER, OP, NUMBER, NEWLINE, ENDMARKER), types("x = 1 + \\\n    2\n"));
    }

    @Test
    public void testTokenText() {
        List<Token> tokens = new PythonLexer("a **= 2\nb = rb'\\x00' != f\"{a}\"\n").tokenize();
        assertEquals("**=", tokens.get(1).text());
        Token bytes = tokens.get(6);
        assertEquals(STRING, bytes.type());
        assertEquals("rb'\\x00'", bytes.text());
        assertEquals(2, bytes.line());
        assertEquals(5, bytes.column());
        assertEquals("!=", tokens.get(7).text());
        assertEquals("f\"{a}\"", tokens.get(8).text());
    }

    @Test
    public void testTripleQuotedStringSpansLines() {
        List<Token> tokens = new PythonLexer("s = \"\"\"a\nb\"\"\"\nt = 1\n").tokenize();
        assertEquals(STRING, tokens.get(2).type());
        assertEquals(1, tokens.get(2).line());
        Token t = tokens.get(4);
        assertEquals("t", t.text());
        assertEquals(3, t.line());
    }

    @Test
    public void testErrors() {
        SourceSyntaxException e = fails("s = 'abc\n");
        assertEquals("unterminated string literal", e.getMessage());
        assertEquals(1, e.line());
        assertEquals(5, e.column());

        assertEquals("invalid hexadecimal literal", fails("x = 0x\n").getMessage());
        assertEquals("invalid decimal literal", fails("x = 1abc\n").getMessage());
        assertEquals("unmatched ')'", fails("x = 1)\n").getMessage());
        assertEquals("closing parenthesis ']' does not match opening parenthesis '('",
                fails("x = (1]\n").getMessage());
        assertEquals("'[' was never closed", fails("x = [1, 2\n").getMessage());

        e = fails("if x:\n    y = 1\n  z = 2\n");
        assertEquals("unindent does not match any outer indentation level", e.getMessage());
        assertEquals(3, e.line());
    }
}
