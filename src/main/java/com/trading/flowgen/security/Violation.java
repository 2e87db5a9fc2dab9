package com.trading.flowgen.security;

/**
 * One security finding.
 *
 * @param line       1-based line, 0 when not tied to a line
 * @param code       the offending construct as written, e.g. {@code import os}
 * @param suggestion remediation shown to the user
 */
public record Violation(Severity severity, int line, String code, String message, String suggestion) {

    public static Violation critical(int line, String code, String message, String suggestion) {
        return new Violation(Severity.CRITICAL, line, code, message, suggestion);
    }

    public static Violation high(int line, String code, String message, String suggestion) {
        return new Violation(Severity.HIGH, line, code, message, suggestion);
    }

    @Override
    public String toString() {
        return severity + " line " + line + ": " + message;
    }
}
