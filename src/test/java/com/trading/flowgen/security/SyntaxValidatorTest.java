package com.trading.flowgen.security;

import org.junit.Test;

import static org.junit.Assert.*;

public class SyntaxValidatorTest {

    private final SyntaxValidator validator = new SyntaxValidator();

    @Test
    public void testValidCode() {
        SyntaxCheckResult r = validator.check("x = 1\nif x > 0:\n    y = x * 2\n");
        assertTrue(r.isValid());
        assertTrue(r.parsed().isPresent());
        assertEquals(2, r.tree().body().size());
    }

    @Test
    public void testEmptyCode() {
        for (String code : new String[] { null, "", "   \n\t" }) {
            SyntaxCheckResult r = validator.check(code);
            assertFalse(r.isValid());
            assertEquals(1, r.errors().size());
            SyntaxError e = r.errors().get(0);
            assertEquals(0, e.line());
            assertEquals(0, e.column());
            assertEquals("Code cannot be empty", e.message());
            assertFalse(r.parsed().isPresent());
        }
    }

    @Test
    public void testMissingColon() {
        SyntaxCheckResult r = validator.check("x = 1\nif x > 0\n    y = 2\n");
        assertFalse(r.isValid());
        SyntaxError e = r.errors().get(0);
        assertEquals(2, e.line());
        assertEquals("expected ':'", e.message());
    }

    @Test
    public void testUnclosedParenthesis() {
        SyntaxCheckResult r = validator.check("x = (1, 2\ny = 3\n");
        SyntaxError e = r.errors().get(0);
        assertEquals("'(' was never closed", e.message());
        assertEquals(1, e.line());
        assertEquals(5, e.column());
    }

    @Test
    public void testUnexpectedIndent() {
        SyntaxCheckResult r = validator.check("x = 1\n    y = 2\n");
        assertEquals("unexpected indent", r.errors().get(0).message());
        assertEquals(2, r.errors().get(0).line());
    }

    @Test
    public void testDeepNestingIsReportedNotThrown() {
        SyntaxCheckResult parens = validator.check("x = " + "(".repeat(50_000) + "1" + ")".repeat(50_000) + "\n");
        assertFalse(parens.isValid());
        SyntaxError e = parens.errors().get(0);
        assertEquals("too many nested parentheses", e.message());
        assertEquals(1, e.line());
        assertEquals(205, e.column());

        SyntaxCheckResult unary = validator.check("x = " + "-".repeat(100_000) + "1\n");
        assertEquals(1, unary.errors().size());
        assertEquals("too many nested expressions", unary.errors().get(0).message());

        StringBuilder blocks = new StringBuilder();
        for (int i = 0; i < 3_000; i++)
            blocks.append(" ".repeat(i)).append("if x:\n");
        blocks.append(" ".repeat(3_000)).append("pass\n");
        SyntaxCheckResult nested = validator.check(blocks.toString());
        assertEquals("too many levels of indentation", nested.errors().get(0).message());
        assertEquals(102, nested.errors().get(0).line());
    }

    @Test
    public void testParserFailureIsReportedNotThrown() {
        SyntaxValidator broken = new SyntaxValidator(src -> {
            throw new IllegalStateException("boom");
        });
        SyntaxCheckResult r = broken.check("x = 1");
        assertFalse(r.isValid());
        assertEquals("Parsing error: boom", r.errors().get(0).message());
    }
}
