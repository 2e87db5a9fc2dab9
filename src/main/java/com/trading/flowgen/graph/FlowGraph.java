package com.trading.flowgen.graph;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Index-based view of a {@link LogicFlow} used by the graph algorithms.
 *
 * <p>
 * Nodes live in an arena addressed by their position in the flow's node list;
 * edges are stored as successor index arrays. No node object references
 * another, so a cycle is plain data:
 * <ul>
 * <li>{@code ids[i]}: node id at arena index i (flow order)</li>
 * <li>{@code successors[i]}: arena indices of i's targets, in edge order</li>
 * </ul>
 * Duplicate edges are kept; self-edges are kept and form one-node cycles.
 */
public final class FlowGraph {
    private final String[] ids;
    private final Map<String, Integer> nameToIndex;
    private final int[][] successors;
    private final int edgeCount;

    private FlowGraph(String[] ids, Map<String, Integer> nameToIndex, int[][] successors, int edgeCount) {
        this.ids = ids;
        this.nameToIndex = nameToIndex;
        this.successors = successors;
        this.edgeCount = edgeCount;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds the arena for a flow.
     *
     * @throws LogicFlowException if the flow is malformed or an edge names a
     *                            node that is not part of the flow
     */
    public static FlowGraph of(LogicFlow flow) {
        if (flow == null || flow.nodes() == null || flow.edges() == null)
            throw new LogicFlowException("Logic flow must contain node and edge lists");
        Builder b = builder();
        for (GraphNode node : flow.nodes()) {
            if (node == null)
                throw new LogicFlowException("Logic flow contains a null node");
            b.addNode(node.nodeId());
        }
        for (GraphEdge edge : flow.edges()) {
            if (edge == null)
                throw new LogicFlowException("Logic flow contains a null edge");
            b.addEdge(edge);
        }
        return b.build();
    }

    public int nodeCount() {
        return ids.length;
    }

    public int edgeCount() {
        return edgeCount;
    }

    public String id(int index) {
        return ids[index];
    }

    public boolean contains(String nodeId) {
        return nameToIndex.containsKey(nodeId);
    }

    /** Resolves a node id to its arena index. */
    public int indexOf(String nodeId) {
        Integer idx = nameToIndex.get(nodeId);
        if (idx == null)
            throw new IllegalArgumentException("Unknown node: " + nodeId);
        return idx;
    }

    public int successorCount(int index) {
        return successors[index].length;
    }

    public int successor(int index, int i) {
        return successors[index][i];
    }

    /**
     * Accumulates nodes and edges before freezing them into arrays.
     */
    public static final class Builder {
        private final List<String> ids = new ArrayList<>();
        private final Map<String, Integer> nameToIdx = new HashMap<>();
        private final List<List<Integer>> forwardEdges = new ArrayList<>();
        private int edges;

        public Builder addNode(String nodeId) {
            if (nodeId == null || nodeId.isBlank())
                throw new LogicFlowException("Node id must not be blank");
            if (nameToIdx.containsKey(nodeId))
                throw new LogicFlowException("Duplicate node id: " + nodeId);
            nameToIdx.put(nodeId, ids.size());
            ids.add(nodeId);
            forwardEdges.add(new ArrayList<>());
            return this;
        }

        public Builder addEdge(String from, String to) {
            return addEdge(GraphEdge.of(from, to));
        }

        public Builder addEdge(GraphEdge edge) {
            Integer from = nameToIdx.get(edge.sourceNodeId());
            Integer to = nameToIdx.get(edge.targetNodeId());
            if (from == null || to == null)
                throw new LogicFlowException("Edge references non-existent node: "
                        + edge.sourceNodeId() + " -> " + edge.targetNodeId(), edge.label());
            forwardEdges.get(from).add(to);
            edges++;
            return this;
        }

        public FlowGraph build() {
            int n = ids.size();
            int[][] succ = new int[n][];
            for (int i = 0; i < n; i++) {
                List<Integer> children = forwardEdges.get(i);
                succ[i] = new int[children.size()];
                for (int j = 0; j < children.size(); j++)
                    succ[i][j] = children.get(j);
            }
            return new FlowGraph(ids.toArray(new String[0]), new HashMap<>(nameToIdx), succ, edges);
        }
    }
}
