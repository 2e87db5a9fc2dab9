package com.trading.flowgen.security;

import com.trading.flowgen.security.ast.PyModule;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of a syntax check. Holds the parsed tree when the code is valid so
 * the security check does not parse twice.
 */
public record SyntaxCheckResult(List<SyntaxError> errors, PyModule tree) {

    public SyntaxCheckResult {
        errors = List.copyOf(errors);
    }

    public static SyntaxCheckResult valid(PyModule tree) {
        return new SyntaxCheckResult(List.of(), tree);
    }

    public static SyntaxCheckResult invalid(SyntaxError error) {
        return new SyntaxCheckResult(List.of(error), null);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public Optional<PyModule> parsed() {
        return Optional.ofNullable(tree);
    }
}
