package com.trading.flowgen.param;

import java.util.List;

/**
 * Outcome of validating one parameter map. Valid iff there are no errors.
 */
public record ParameterValidationResult(List<ParameterError> errors) {
    private static final ParameterValidationResult VALID = new ParameterValidationResult(List.of());

    public ParameterValidationResult {
        errors = List.copyOf(errors);
    }

    public static ParameterValidationResult valid() {
        return VALID;
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<ParameterError> errorsFor(String field) {
        return errors.stream().filter(e -> field.equals(e.field())).toList();
    }
}
