package com.trading.flowgen.dsl;

import com.trading.flowgen.graph.GraphEdge;
import com.trading.flowgen.graph.GraphNode;
import com.trading.flowgen.graph.LogicFlow;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fluent construction of a {@link LogicFlow} and its node parameters.
 *
 * <pre>
 * FlowBuilder f = FlowBuilder.create();
 * f.node("fast", "sma").param("period", 10);
 * f.node("slow", "sma").param("period", 30);
 * f.node("cross", "crossover");
 * f.connect("fast", "cross", "fast").connect("slow", "cross", "slow");
 * LogicFlow flow = f.build();
 * </pre>
 *
 * Edges may reference nodes declared later; dangling references are left for
 * the validator to report.
 */
public final class FlowBuilder {
    private final List<GraphNode> nodes = new ArrayList<>();
    private final Map<String, GraphNode> nodesById = new HashMap<>();
    private final List<GraphEdge> edges = new ArrayList<>();
    private final Map<String, Map<String, Object>> parameters = new LinkedHashMap<>();
    private int edgeSeq;

    // Flag to prevent modification after building
    private boolean built;

    private FlowBuilder() {
    }

    public static FlowBuilder create() {
        return new FlowBuilder();
    }

    // ── Nodes ────────────────────────────────────────────────────

    public NodeSpec node(String nodeId, String templateId) {
        return node(new GraphNode(nodeId, templateId, null, null, null));
    }

    /** Adds a node carrying declared port types. */
    public NodeSpec node(String nodeId, String templateId, String outputType, String inputType) {
        return node(new GraphNode(nodeId, templateId, null, outputType, inputType));
    }

    public NodeSpec node(GraphNode node) {
        checkNotBuilt();
        if (node.nodeId() == null || node.nodeId().isBlank())
            throw new IllegalArgumentException("Node id must not be blank");
        if (nodesById.containsKey(node.nodeId()))
            throw new IllegalArgumentException("Duplicate node id: " + node.nodeId());
        nodes.add(node);
        nodesById.put(node.nodeId(), node);
        return new NodeSpec(node.nodeId());
    }

    // ── Edges ────────────────────────────────────────────────────

    public FlowBuilder edge(String sourceNodeId, String targetNodeId) {
        return connect(sourceNodeId, null, targetNodeId, null);
    }

    /** Connects {@code source} into the named input port of {@code target}. */
    public FlowBuilder connect(String sourceNodeId, String targetNodeId, String targetPort) {
        return connect(sourceNodeId, null, targetNodeId, targetPort);
    }

    public FlowBuilder connect(String sourceNodeId, String sourcePort, String targetNodeId, String targetPort) {
        checkNotBuilt();
        edges.add(new GraphEdge("e" + (++edgeSeq), sourceNodeId, targetNodeId, sourcePort, targetPort));
        return this;
    }

    // ── Parameters ───────────────────────────────────────────────

    public FlowBuilder param(String nodeId, String name, Object value) {
        checkNotBuilt();
        if (!nodesById.containsKey(nodeId))
            throw new IllegalArgumentException("Unknown node: " + nodeId);
        parameters.computeIfAbsent(nodeId, k -> new LinkedHashMap<>()).put(name, value);
        return this;
    }

    /** Per-node parameter maps collected so far, keyed by node id. */
    public Map<String, Map<String, Object>> parameters() {
        Map<String, Map<String, Object>> copy = new LinkedHashMap<>();
        parameters.forEach((id, p) -> copy.put(id, new LinkedHashMap<>(p)));
        return copy;
    }

    public LogicFlow build() {
        checkNotBuilt();
        built = true;
        return LogicFlow.of(nodes, edges);
    }

    private void checkNotBuilt() {
        if (built)
            throw new IllegalStateException("Flow already built");
    }

    /** Handle returned by {@link #node} for chaining parameters onto the new node. */
    public final class NodeSpec {
        private final String nodeId;

        private NodeSpec(String nodeId) {
            this.nodeId = nodeId;
        }

        public NodeSpec param(String name, Object value) {
            FlowBuilder.this.param(nodeId, name, value);
            return this;
        }

        public String id() {
            return nodeId;
        }

        public FlowBuilder and() {
            return FlowBuilder.this;
        }
    }
}
