package com.trading.flowgen.security;

import com.trading.flowgen.security.ast.PythonParser;

import lombok.extern.log4j.Log4j2;

/**
 * Checks that generated code is non-empty and parses.
 */
@Log4j2
public final class SyntaxValidator {
    static final String EMPTY_CODE = "Code cannot be empty";

    private final SourceParser parser;

    public SyntaxValidator() {
        this(new PythonParser());
    }

    public SyntaxValidator(SourceParser parser) {
        this.parser = parser;
    }

    public SyntaxCheckResult check(String code) {
        if (code == null || code.isBlank())
            return SyntaxCheckResult.invalid(new SyntaxError(0, 0, EMPTY_CODE));
        try {
            return SyntaxCheckResult.valid(parser.parse(code));
        } catch (SourceSyntaxException e) {
            log.debug("Syntax error at {}:{}: {}", e.line(), e.column(), e.getMessage());
            return SyntaxCheckResult.invalid(SyntaxError.of(e));
        } catch (RuntimeException e) {
            log.error("Parser failure", e);
            return SyntaxCheckResult.invalid(new SyntaxError(0, 0, "Parsing error: " + e.getMessage()));
        }
    }
}
