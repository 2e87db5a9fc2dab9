package com.trading.flowgen;

import com.trading.flowgen.api.ValidationStatus;
import com.trading.flowgen.codegen.CodeGenerationRecord;
import com.trading.flowgen.graph.FlowValidationResult;
import com.trading.flowgen.param.ParameterValidationResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Result of one pass through {@link StrategyBuilder}.
 *
 * <p>
 * Either the request was rejected before generation (invalid flow or
 * parameters, {@code record} is null), or a record was produced. A produced
 * record is either freshly validated and saved, or an earlier record for the
 * same instance with identical code ({@code reused}).
 *
 * @param flowValidation  graph validation result; always present
 * @param parameterErrors invalid parameter maps keyed by node id, in flow order
 */
public record GenerationOutcome(FlowValidationResult flowValidation,
        Map<String, ParameterValidationResult> parameterErrors,
        CodeGenerationRecord record,
        boolean reused) {

    public GenerationOutcome {
        parameterErrors = Collections.unmodifiableMap(new LinkedHashMap<>(parameterErrors));
    }

    static GenerationOutcome rejected(FlowValidationResult flow, Map<String, ParameterValidationResult> params) {
        return new GenerationOutcome(flow, params, null, false);
    }

    static GenerationOutcome generated(FlowValidationResult flow, CodeGenerationRecord record, boolean reused) {
        return new GenerationOutcome(flow, Map.of(), record, reused);
    }

    public boolean isRejected() {
        return record == null;
    }

    /** True when a record exists and its code passed both checks. */
    public boolean isSuccess() {
        return record != null && record.isUsable();
    }

    public Optional<ValidationStatus> status() {
        return Optional.ofNullable(record).map(CodeGenerationRecord::getValidationStatus);
    }
}
