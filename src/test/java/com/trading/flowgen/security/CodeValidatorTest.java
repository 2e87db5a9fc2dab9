package com.trading.flowgen.security;

import com.trading.flowgen.api.ValidationStatus;
import com.trading.flowgen.codegen.CodeGenerationRecord;
import com.trading.flowgen.codegen.CodeHasher;
import org.junit.Test;

import static org.junit.Assert.*;

public class CodeValidatorTest {

    private final CodeValidator validator = new CodeValidator(SecurityPolicy.defaults());

    private static CodeGenerationRecord pending(String code) {
        return CodeGenerationRecord.builder()
                .id("r1")
                .instanceId("inst")
                .generatedCode(code)
                .codeHash(CodeHasher.hash(code))
                .build();
    }

    @Test
    public void testCheckStatuses() {
        assertEquals(ValidationStatus.VALID, validator.check("import numpy as np\nx = np.zeros(3)\n").status());
        assertEquals(ValidationStatus.SECURITY_ERROR, validator.check("import socket\n").status());

        CodeCheck bad = validator.check("x = = 1\n");
        assertEquals(ValidationStatus.SYNTAX_ERROR, bad.status());
        assertFalse(bad.isValid());
        assertEquals("Invalid Python syntax", bad.security().violations().get(0).message());
    }

    @Test
    public void testValidateValid() {
        CodeGenerationRecord r = validator.validate(pending("import pandas as pd\ns = pd.Series([1, 2])\n"));
        assertEquals(ValidationStatus.VALID, r.getValidationStatus());
        assertTrue(r.isSyntaxCheckPassed());
        assertTrue(r.isSecurityCheckPassed());
        assertTrue(r.getSecurityViolations().isEmpty());
    }

    @Test
    public void testValidateSecurityError() {
        CodeGenerationRecord r = validator.validate(pending("import os\nos.system('ls')\n"));
        assertEquals(ValidationStatus.SECURITY_ERROR, r.getValidationStatus());
        assertTrue(r.isSyntaxCheckPassed());
        assertFalse(r.isSecurityCheckPassed());
        assertEquals(2, r.getSecurityViolations().size());
    }

    @Test
    public void testValidateSyntaxError() {
        CodeGenerationRecord r = validator.validate(pending("def f(:\n"));
        assertEquals(ValidationStatus.SYNTAX_ERROR, r.getValidationStatus());
        assertFalse(r.isSyntaxCheckPassed());
        assertFalse(r.isSecurityCheckPassed());
        assertEquals(1, r.getSyntaxErrors().size());
        assertEquals(1, r.getSecurityViolations().size());
    }

    @Test(expected = IllegalStateException.class)
    public void testValidateTwice() {
        CodeGenerationRecord r = validator.validate(pending("x = 1\n"));
        validator.validate(r);
    }
}
