package com.trading.flowgen.codegen;

import com.trading.flowgen.api.ValidationStatus;
import com.trading.flowgen.graph.LogicFlow;
import com.trading.flowgen.security.SyntaxError;
import com.trading.flowgen.security.Violation;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * One generated strategy module and its validation state.
 *
 * <p>
 * Immutable. Status changes go through the {@code mark*} methods, which
 * return a new record and reject transitions the lifecycle does not allow
 * with {@link IllegalStateException}.
 */
@Value
@Builder(toBuilder = true)
public class CodeGenerationRecord {
    String id;
    @NonNull
    String instanceId;
    String ownerId;
    LogicFlow logicFlowSnapshot;
    Map<String, Map<String, Object>> parametersSnapshot;
    @NonNull
    String generatedCode;
    @NonNull
    String codeHash;
    @NonNull
    @Builder.Default
    ValidationStatus validationStatus = ValidationStatus.PENDING;
    boolean syntaxCheckPassed;
    boolean securityCheckPassed;
    @Singular
    List<SyntaxError> syntaxErrors;
    @Singular
    List<Violation> securityViolations;
    @Singular
    List<String> warnings;
    @Singular("executionStep")
    List<String> executionOrder;
    String runtimeError;
    @Builder.Default
    Instant createdAt = Instant.now();

    public CodeGenerationRecord markSyntaxError(List<SyntaxError> errors, List<Violation> violations) {
        return transition(ValidationStatus.SYNTAX_ERROR)
                .syntaxCheckPassed(false)
                .securityCheckPassed(false)
                .clearSyntaxErrors().syntaxErrors(errors)
                .clearSecurityViolations().securityViolations(violations)
                .build();
    }

    public CodeGenerationRecord markSecurityError(List<Violation> violations) {
        return transition(ValidationStatus.SECURITY_ERROR)
                .syntaxCheckPassed(true)
                .securityCheckPassed(false)
                .clearSecurityViolations().securityViolations(violations)
                .build();
    }

    public CodeGenerationRecord markValid() {
        return transition(ValidationStatus.VALID)
                .syntaxCheckPassed(true)
                .securityCheckPassed(true)
                .build();
    }

    /** Recorded by an execution step outside this library once a valid module fails at run time. */
    public CodeGenerationRecord markRuntimeError(String message) {
        return transition(ValidationStatus.RUNTIME_ERROR)
                .runtimeError(message)
                .build();
    }

    public boolean isUsable() {
        return validationStatus == ValidationStatus.VALID;
    }

    private CodeGenerationRecordBuilder transition(ValidationStatus next) {
        if (!validationStatus.canTransitionTo(next))
            throw new IllegalStateException(
                    "Illegal status transition " + validationStatus + " -> " + next + " for record " + id);
        return toBuilder().validationStatus(next);
    }
}
