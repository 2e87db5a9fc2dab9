package com.trading.flowgen.graph;

import java.util.List;
import java.util.Map;

/**
 * Summary attached to every validation result.
 *
 * @param nodeKinds      node count per kind label
 * @param executionOrder topological order; empty unless the flow is a valid DAG
 */
public record FlowMetadata(int nodeCount, int edgeCount, Map<String, Integer> nodeKinds,
        List<String> executionOrder) {

    public FlowMetadata {
        nodeKinds = Map.copyOf(nodeKinds);
        executionOrder = List.copyOf(executionOrder);
    }

    public static FlowMetadata empty() {
        return new FlowMetadata(0, 0, Map.of(), List.of());
    }
}
