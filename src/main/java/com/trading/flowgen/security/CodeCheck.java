package com.trading.flowgen.security;

import com.trading.flowgen.api.ValidationStatus;

/**
 * Combined outcome of the syntax and security checks on one piece of code.
 * The security result is always present, even when parsing failed.
 */
public record CodeCheck(ValidationStatus status, SyntaxCheckResult syntax, SecurityCheckResult security) {

    public boolean isValid() {
        return status == ValidationStatus.VALID;
    }
}
