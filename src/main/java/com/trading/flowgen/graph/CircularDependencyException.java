package com.trading.flowgen.graph;

import java.util.List;

/**
 * Raised when an execution order is requested for a graph that contains a cycle.
 */
public class CircularDependencyException extends LogicFlowException {
    private final List<String> cycle;

    public CircularDependencyException(List<String> cycle) {
        super("Circular dependency detected: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    /** Node ids forming the cycle; the last one has an edge back to the first. */
    public List<String> cycle() {
        return cycle;
    }
}
