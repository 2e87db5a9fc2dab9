package com.trading.flowgen.graph;

/**
 * Directed connection from the output of one node to the input of another.
 * Ports are optional.
 */
public record GraphEdge(String edgeId, String sourceNodeId, String targetNodeId, String sourcePort,
        String targetPort) {

    public static GraphEdge of(String sourceNodeId, String targetNodeId) {
        return new GraphEdge(sourceNodeId + "->" + targetNodeId, sourceNodeId, targetNodeId, null, null);
    }

    public static GraphEdge of(String sourceNodeId, String sourcePort, String targetNodeId, String targetPort) {
        return new GraphEdge(sourceNodeId + "->" + targetNodeId, sourceNodeId, targetNodeId, sourcePort,
                targetPort);
    }

    /** Identifier used in reports: the edge id, or {@code source->target} when the editor sent none. */
    public String label() {
        return edgeId != null ? edgeId : sourceNodeId + "->" + targetNodeId;
    }
}
