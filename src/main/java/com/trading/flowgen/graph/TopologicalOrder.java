package com.trading.flowgen.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import lombok.extern.log4j.Log4j2;

/**
 * Execution order of an acyclic {@link FlowGraph}.
 *
 * <p>
 * Computed with Kahn's algorithm: nodes with in-degree zero are queued in flow
 * order, and nodes freed while draining the queue are appended in the order
 * they are discovered. For every edge {@code a -> b}, {@code a} precedes
 * {@code b}.
 */
@Log4j2
public final class TopologicalOrder {
    private final List<String> order;
    // position[arenaIndex] = place of that node in the order
    private final int[] position;
    private final FlowGraph graph;

    private TopologicalOrder(FlowGraph graph, List<String> order, int[] position) {
        this.graph = graph;
        this.order = order;
        this.position = position;
    }

    public static TopologicalOrder of(LogicFlow flow) {
        return of(FlowGraph.of(flow));
    }

    /**
     * Sorts the graph.
     *
     * @throws CircularDependencyException if the graph contains a cycle; no
     *                                     partial order is ever returned
     * @throws IllegalStateException       if Kahn's algorithm leaves nodes
     *                                     unsorted although no cycle was
     *                                     found (a bug, not an input error)
     */
    public static TopologicalOrder of(FlowGraph graph) {
        Optional<List<String>> cycle = CycleDetector.findCycle(graph);
        if (cycle.isPresent())
            throw new CircularDependencyException(cycle.get());

        int n = graph.nodeCount();
        int[] inDegree = new int[n];

        // 1. Calculate in-degrees
        for (int i = 0; i < n; i++)
            for (int j = 0; j < graph.successorCount(i); j++)
                inDegree[graph.successor(i, j)]++;

        // 2. Seed queue with in-degree 0 nodes, in flow order
        int[] queue = new int[n];
        int head = 0, tail = 0;
        for (int i = 0; i < n; i++)
            if (inDegree[i] == 0)
                queue[tail++] = i;

        // 3. Drain (Kahn's algorithm)
        List<String> sorted = new ArrayList<>(n);
        int[] position = new int[n];
        while (head < tail) {
            int curr = queue[head++];
            position[curr] = sorted.size();
            sorted.add(graph.id(curr));
            for (int j = 0; j < graph.successorCount(curr); j++) {
                int child = graph.successor(curr, j);
                if (--inDegree[child] == 0)
                    queue[tail++] = child;
            }
        }
        if (sorted.size() != n) {
            log.error("Topological sort processed {} of {} nodes after cycle check passed", sorted.size(), n);
            throw new IllegalStateException("Topological sort incomplete: processed " + sorted.size() + " of " + n);
        }
        log.debug("Topological order: {}", sorted);
        return new TopologicalOrder(graph, Collections.unmodifiableList(sorted), position);
    }

    public int size() {
        return order.size();
    }

    public List<String> nodeIds() {
        return order;
    }

    public String nodeAt(int position) {
        return order.get(position);
    }

    /** Place of the node in the execution order. */
    public int positionOf(String nodeId) {
        return position[graph.indexOf(nodeId)];
    }

    public boolean precedes(String a, String b) {
        return positionOf(a) < positionOf(b);
    }
}
