package com.trading.flowgen.io;

import com.trading.flowgen.graph.GraphEdge;
import com.trading.flowgen.graph.GraphNode;
import com.trading.flowgen.graph.LogicFlow;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads editor JSON into a {@link LogicFlow} and its per-node parameters.
 *
 * <pre>
 * { "nodes": [ { "id": "sma", "template_id": "sma", "parameters": { "period": 20 } } ],
 *   "edges": [ { "id": "e1", "source": "sma", "target": "cond", "targetPort": "value" } ] }
 * </pre>
 *
 * The reader is lenient: a non-array {@code nodes} or {@code edges} yields a
 * null list and a non-object element yields a null entry, so that
 * {@link com.trading.flowgen.graph.LogicFlowValidator} reports the shape error.
 */
public final class LogicFlowReader {
    private static final TypeReference<LinkedHashMap<String, Object>> MAP = new TypeReference<>() {
    };

    private final ObjectMapper mapper = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    /** Flow plus the parameter maps found on its nodes, keyed by node id. */
    public record ReadResult(LogicFlow flow, Map<String, Map<String, Object>> parameters) {
    }

    public ReadResult read(String json) throws IOException {
        return read(mapper.readTree(json));
    }

    public ReadResult read(InputStream in) throws IOException {
        return read(mapper.readTree(in));
    }

    public ReadResult read(JsonNode root) {
        if (root == null || !root.isObject())
            return new ReadResult(new LogicFlow(null, null), Map.of());

        Map<String, Map<String, Object>> parameters = new LinkedHashMap<>();
        List<GraphNode> nodes = null;
        JsonNode nodesJson = root.get("nodes");
        if (nodesJson != null && nodesJson.isArray()) {
            nodes = new ArrayList<>();
            for (JsonNode n : nodesJson) {
                GraphNode node = readNode(n);
                nodes.add(node);
                if (node != null && node.nodeId() != null && n.path("parameters").isObject())
                    parameters.put(node.nodeId(), mapper.convertValue(n.get("parameters"), MAP));
            }
        }

        List<GraphEdge> edges = null;
        JsonNode edgesJson = root.get("edges");
        if (edgesJson == null) {
            edges = List.of();
        } else if (edgesJson.isArray()) {
            edges = new ArrayList<>();
            for (JsonNode e : edgesJson)
                edges.add(readEdge(e));
        }

        JsonNode extra = root.get("parameters");
        if (extra != null && extra.isObject()) {
            extra.fields().forEachRemaining(entry -> {
                if (entry.getValue().isObject())
                    parameters.merge(entry.getKey(), mapper.convertValue(entry.getValue(), MAP), (a, b) -> {
                        Map<String, Object> merged = new LinkedHashMap<>(a);
                        merged.putAll(b);
                        return merged;
                    });
            });
        }
        return new ReadResult(new LogicFlow(nodes, edges), Collections.unmodifiableMap(parameters));
    }

    private static GraphNode readNode(JsonNode n) {
        if (!n.isObject())
            return null;
        return new GraphNode(text(n, "id"), text(n, "template_id", "templateId"), text(n, "type"),
                text(n, "output_type", "outputType"), text(n, "input_type", "inputType"));
    }

    private static GraphEdge readEdge(JsonNode e) {
        if (!e.isObject())
            return null;
        return new GraphEdge(text(e, "id"), text(e, "source"), text(e, "target"),
                text(e, "sourcePort", "source_port"), text(e, "targetPort", "target_port"));
    }

    private static String text(JsonNode n, String... keys) {
        for (String key : keys) {
            JsonNode v = n.get(key);
            if (v != null && !v.isNull())
                return v.isValueNode() ? v.asText() : v.toString();
        }
        return null;
    }
}
