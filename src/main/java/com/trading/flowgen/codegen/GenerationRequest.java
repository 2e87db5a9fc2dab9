package com.trading.flowgen.codegen;

import com.trading.flowgen.graph.LogicFlow;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Input to one generation.
 *
 * @param parameters explicit parameter values per node id; nodes without an
 *                   entry use their template defaults
 */
public record GenerationRequest(String instanceId, String ownerId, LogicFlow flow,
        Map<String, Map<String, Object>> parameters) {

    public GenerationRequest {
        Objects.requireNonNull(instanceId, "instanceId");
        Objects.requireNonNull(flow, "flow");
        Map<String, Map<String, Object>> copy = new LinkedHashMap<>();
        if (parameters != null)
            parameters.forEach((k, v) -> copy.put(k,
                    v == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(v))));
        parameters = Collections.unmodifiableMap(copy);
    }

    public static GenerationRequest of(String instanceId, LogicFlow flow) {
        return new GenerationRequest(instanceId, null, flow, Map.of());
    }

    public Map<String, Object> parametersOf(String nodeId) {
        return parameters.getOrDefault(nodeId, Map.of());
    }
}
