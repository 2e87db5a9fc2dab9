package com.trading.flowgen.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * User-authored strategy graph: an ordered list of nodes plus a list of edges.
 * <p>
 * Values are immutable; every edit returns a new flow that must be validated
 * again. A flow built from raw editor input may be malformed (null lists or
 * elements) until {@link LogicFlowValidator} has accepted it.
 */
public record LogicFlow(List<GraphNode> nodes, List<GraphEdge> edges) {
    private static final LogicFlow EMPTY = new LogicFlow(List.of(), List.of());

    public LogicFlow {
        // Nulls are kept so the validator can report them as shape errors.
        nodes = nodes == null ? null : Collections.unmodifiableList(new ArrayList<>(nodes));
        edges = edges == null ? null : Collections.unmodifiableList(new ArrayList<>(edges));
    }

    public static LogicFlow empty() {
        return EMPTY;
    }

    public static LogicFlow of(List<GraphNode> nodes, List<GraphEdge> edges) {
        return new LogicFlow(nodes, edges);
    }

    public Optional<GraphNode> node(String nodeId) {
        if (nodes == null)
            return Optional.empty();
        return nodes.stream().filter(n -> n != null && Objects.equals(n.nodeId(), nodeId)).findFirst();
    }

    public List<String> nodeIds() {
        if (nodes == null)
            return List.of();
        return nodes.stream().filter(Objects::nonNull).map(GraphNode::nodeId).toList();
    }

    public LogicFlow withNode(GraphNode node) {
        List<GraphNode> copy = new ArrayList<>(orEmpty(nodes));
        copy.add(node);
        return new LogicFlow(copy, orEmpty(edges));
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }
}
