package com.trading.flowgen.codegen;

import com.trading.flowgen.api.ValidationStatus;
import com.trading.flowgen.security.Severity;
import com.trading.flowgen.security.SyntaxError;
import com.trading.flowgen.security.Violation;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class CodeGenerationRecordTest {

    private static CodeGenerationRecord pending() {
        return CodeGenerationRecord.builder()
                .id("r1")
                .instanceId("inst")
                .generatedCode("x = 1\n")
                .codeHash(CodeHasher.hash("x = 1\n"))
                .build();
    }

    @Test
    public void testStartsPending() {
        CodeGenerationRecord r = pending();
        assertEquals(ValidationStatus.PENDING, r.getValidationStatus());
        assertFalse(r.isUsable());
        assertNotNull(r.getCreatedAt());
    }

    @Test
    public void testValid() {
        CodeGenerationRecord r = pending().markValid();
        assertEquals(ValidationStatus.VALID, r.getValidationStatus());
        assertTrue(r.isSyntaxCheckPassed());
        assertTrue(r.isSecurityCheckPassed());
        assertTrue(r.isUsable());

        CodeGenerationRecord failed = r.markRuntimeError("ZeroDivisionError");
        assertEquals(ValidationStatus.RUNTIME_ERROR, failed.getValidationStatus());
        assertEquals("ZeroDivisionError", failed.getRuntimeError());
        assertFalse(failed.isUsable());
    }

    @Test
    public void testSyntaxError() {
        CodeGenerationRecord r = pending().markSyntaxError(
                List.of(new SyntaxError(3, 5, "invalid syntax")),
                List.of(Violation.critical(0, "", "Invalid Python syntax", "Fix syntax errors")));
        assertEquals(ValidationStatus.SYNTAX_ERROR, r.getValidationStatus());
        assertFalse(r.isSyntaxCheckPassed());
        assertFalse(r.isSecurityCheckPassed());
        assertEquals(3, r.getSyntaxErrors().get(0).line());
        assertEquals(Severity.CRITICAL, r.getSecurityViolations().get(0).severity());
    }

    @Test
    public void testSecurityError() {
        CodeGenerationRecord r = pending().markSecurityError(
                List.of(Violation.critical(1, "import os", "Forbidden import detected: os", "Remove import of os")));
        assertEquals(ValidationStatus.SECURITY_ERROR, r.getValidationStatus());
        assertTrue(r.isSyntaxCheckPassed());
        assertFalse(r.isSecurityCheckPassed());
        assertEquals(1, r.getSecurityViolations().size());
    }

    @Test
    public void testIllegalTransitions() {
        CodeGenerationRecord valid = pending().markValid();
        assertIllegal(() -> valid.markValid());
        assertIllegal(() -> valid.markSecurityError(List.of()));
        assertIllegal(() -> pending().markRuntimeError("boom"));

        CodeGenerationRecord rejected = pending().markSecurityError(List.of());
        assertIllegal(() -> rejected.markValid());
        assertTrue(ValidationStatus.SECURITY_ERROR.isTerminal());
        assertFalse(ValidationStatus.VALID.isTerminal());
    }

    @Test(expected = NullPointerException.class)
    public void testCodeRequired() {
        CodeGenerationRecord.builder().instanceId("inst").codeHash("h").build();
    }

    private static void assertIllegal(Runnable r) {
        try {
            r.run();
            fail("Expected IllegalStateException");
        } catch (IllegalStateException expected) {
            // ok
        }
    }
}
