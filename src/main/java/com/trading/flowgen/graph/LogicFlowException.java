package com.trading.flowgen.graph;

/**
 * Structural defect in a logic flow that makes graph traversal unsafe.
 */
public class LogicFlowException extends RuntimeException {
    private final String edgeId;

    public LogicFlowException(String message) {
        this(message, null);
    }

    public LogicFlowException(String message, String edgeId) {
        super(message);
        this.edgeId = edgeId;
    }

    /** Edge that caused the failure, or null when the defect is not edge-specific. */
    public String edgeId() {
        return edgeId;
    }
}
