package com.trading.flowgen.api;

/**
 * Lifecycle of a generated module.
 *
 * <pre>
 * PENDING -> SYNTAX_ERROR
 * PENDING -> SECURITY_ERROR
 * PENDING -> VALID -> RUNTIME_ERROR
 * </pre>
 *
 * RUNTIME_ERROR is only reached from a later execution step.
 */
public enum ValidationStatus {
    PENDING,
    VALID,
    SYNTAX_ERROR,
    SECURITY_ERROR,
    RUNTIME_ERROR;

    public boolean isTerminal() {
        return this != PENDING && this != VALID;
    }

    /** Whether a record in this state may move to {@code next}. */
    public boolean canTransitionTo(ValidationStatus next) {
        return switch (this) {
            case PENDING -> next == VALID || next == SYNTAX_ERROR || next == SECURITY_ERROR;
            case VALID -> next == RUNTIME_ERROR;
            default -> false;
        };
    }
}
