package com.trading.flowgen.graph;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of {@link LogicFlowValidator#validate}. Valid iff there are no errors;
 * warnings never fail a flow.
 */
public record FlowValidationResult(List<FlowIssue> errors, List<FlowIssue> warnings, FlowMetadata metadata) {

    public FlowValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public static FlowValidationResult structuralFailure(FlowIssue issue) {
        return new FlowValidationResult(List.of(issue), List.of(), FlowMetadata.empty());
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public boolean hasError(FlowIssue.Code code) {
        return errors.stream().anyMatch(e -> e.code() == code);
    }

    /** The reported cycle, if cycle detection failed the flow. */
    public Optional<List<String>> cycle() {
        return errors.stream()
                .filter(e -> e.code() == FlowIssue.Code.CIRCULAR_DEPENDENCY)
                .map(FlowIssue::cycle)
                .findFirst();
    }
}
