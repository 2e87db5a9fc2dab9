package com.trading.flowgen.param;

import com.trading.flowgen.api.TemplateLookup;
import com.trading.flowgen.graph.GraphNode;
import com.trading.flowgen.graph.LogicFlow;
import com.trading.flowgen.template.NodeTemplate;
import com.trading.flowgen.template.ParameterField;
import com.trading.flowgen.template.ParameterSchema;
import com.trading.flowgen.template.ValueType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.extern.log4j.Log4j2;

/**
 * Checks node parameter values against a template's {@link ParameterSchema}.
 * <p>
 * All problems are accumulated so a caller can report them in one pass.
 * Fields absent from the schema are ignored: templates may gain fields later.
 */
@Log4j2
public final class ParameterValidator {

    public ParameterValidationResult validate(Map<String, ?> parameters, ParameterSchema schema) {
        if (schema == null || schema.isEmpty())
            return ParameterValidationResult.valid();
        Map<String, ?> params = parameters != null ? parameters : Collections.emptyMap();
        List<ParameterError> errors = new ArrayList<>();

        for (String required : schema.requiredFields()) {
            if (!params.containsKey(required)) {
                errors.add(new ParameterError(required, ParameterError.Code.MISSING_REQUIRED,
                        "Required parameter '" + required + "' is missing"));
            }
        }

        for (Map.Entry<String, ?> entry : params.entrySet()) {
            ParameterField field = schema.field(entry.getKey());
            if (field == null)
                continue;
            checkField(field, entry.getValue(), errors);
        }

        if (!errors.isEmpty())
            log.debug("Parameter validation found {} error(s): {}", errors.size(), errors);
        return new ParameterValidationResult(errors);
    }

    public ParameterValidationResult validateNode(GraphNode node, NodeTemplate template, Map<String, ?> parameters) {
        ParameterValidationResult result = validate(parameters, template.getParameterSchema());
        if (!result.isValid())
            log.debug("Node {} ({}) has invalid parameters", node.nodeId(), template.getId());
        return result;
    }

    /**
     * Validates the effective parameters of every node whose template resolves:
     * the template defaults overlaid by the node's explicit values, which is
     * what the generator renders.
     *
     * @param parameters per-node parameter maps keyed by node id
     * @return results keyed by node id, in flow order; only invalid nodes are included
     */
    public Map<String, ParameterValidationResult> validateFlow(LogicFlow flow,
            Map<String, ? extends Map<String, ?>> parameters, TemplateLookup lookup) {
        Map<String, ParameterValidationResult> failures = new LinkedHashMap<>();
        Map<String, ? extends Map<String, ?>> byNode = parameters != null ? parameters : Collections.emptyMap();
        for (GraphNode node : flow.nodes()) {
            Optional<NodeTemplate> template = lookup.getTemplate(node.templateId());
            if (template.isEmpty())
                continue;
            Map<String, Object> effective = new LinkedHashMap<>(template.get().defaultParameters());
            Map<String, ?> explicit = byNode.get(node.nodeId());
            if (explicit != null)
                effective.putAll(explicit);
            ParameterValidationResult result = validateNode(node, template.get(), effective);
            if (!result.isValid())
                failures.put(node.nodeId(), result);
        }
        return failures;
    }

    private static void checkField(ParameterField field, Object value, List<ParameterError> errors) {
        String name = field.name();
        ValueType type = field.type();
        if (!type.accepts(value)) {
            errors.add(new ParameterError(name, ParameterError.Code.TYPE_MISMATCH,
                    "Parameter '" + name + "' type error: must be " + article(type) + " " + type.jsonName()
                            + ", got " + ValueType.describe(value)));
            return;
        }
        switch (type) {
            case INTEGER, NUMBER -> checkRange(field, (Number) value, errors);
            case STRING -> {
                if (field.hasEnum() && !field.enumValues().contains(value)) {
                    errors.add(new ParameterError(name, ParameterError.Code.NOT_IN_ENUM,
                            "Parameter '" + name + "' value '" + value + "' not in allowed values: "
                                    + field.enumValues()));
                }
            }
            case BOOLEAN -> {
                // type check is sufficient
            }
        }
    }

    private static void checkRange(ParameterField field, Number value, List<ParameterError> errors) {
        double v = value.doubleValue();
        if (field.minimum() != null && v < field.minimum()) {
            errors.add(new ParameterError(field.name(), ParameterError.Code.BELOW_MINIMUM,
                    "Parameter '" + field.name() + "' value " + value + " is below minimum "
                            + formatBound(field.minimum())));
        }
        if (field.maximum() != null && v > field.maximum()) {
            errors.add(new ParameterError(field.name(), ParameterError.Code.ABOVE_MAXIMUM,
                    "Parameter '" + field.name() + "' value " + value + " exceeds maximum "
                            + formatBound(field.maximum())));
        }
    }

    private static String formatBound(double bound) {
        return bound == Math.rint(bound) && !Double.isInfinite(bound)
                ? Long.toString((long) bound)
                : Double.toString(bound);
    }

    private static String article(ValueType type) {
        return type == ValueType.INTEGER ? "an" : "a";
    }
}
