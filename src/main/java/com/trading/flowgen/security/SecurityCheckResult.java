package com.trading.flowgen.security;

import java.util.List;

/**
 * Outcome of a security check: safe iff there are no violations, whatever
 * their severity.
 */
public record SecurityCheckResult(List<Violation> violations) {

    static final String INVALID_SYNTAX = "Invalid Python syntax";

    public SecurityCheckResult {
        violations = List.copyOf(violations);
    }

    /** Uniform answer for code that does not parse. */
    public static SecurityCheckResult invalidSyntax() {
        return new SecurityCheckResult(List.of(Violation.critical(0, "", INVALID_SYNTAX,
                "Fix syntax errors before security validation")));
    }

    public boolean isSafe() {
        return violations.isEmpty();
    }

    public List<Violation> withSeverity(Severity severity) {
        return violations.stream().filter(v -> v.severity() == severity).toList();
    }

    public boolean hasCritical() {
        return violations.stream().anyMatch(v -> v.severity() == Severity.CRITICAL);
    }
}
