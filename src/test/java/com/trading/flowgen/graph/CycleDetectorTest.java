package com.trading.flowgen.graph;

import org.junit.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.Assert.*;

public class CycleDetectorTest {

    private static LogicFlow flow(List<String> ids, GraphEdge... edges) {
        return LogicFlow.of(ids.stream().map(id -> GraphNode.of(id, "t")).toList(), List.of(edges));
    }

    @Test
    public void testThreeNodeCycle() {
        // A -> B -> C -> A
        LogicFlow f = flow(List.of("A", "B", "C"),
                GraphEdge.of("A", "B"), GraphEdge.of("B", "C"), GraphEdge.of("C", "A"));

        Optional<List<String>> cycle = CycleDetector.findCycle(FlowGraph.of(f));
        assertTrue(cycle.isPresent());
        assertEquals(List.of("A", "B", "C"), cycle.get());

        try {
            TopologicalOrder.of(f);
            fail("Expected CircularDependencyException");
        } catch (CircularDependencyException e) {
            assertEquals(List.of("A", "B", "C"), e.cycle());
            assertEquals("Circular dependency detected: A -> B -> C", e.getMessage());
        }
    }

    @Test
    public void testSelfLoop() {
        LogicFlow f = flow(List.of("A"), GraphEdge.of("A", "A"));
        assertEquals(List.of("A"), CycleDetector.findCycle(FlowGraph.of(f)).orElseThrow());
    }

    @Test
    public void testCycleBehindAcyclicPrefix() {
        // X -> A -> B -> A: only A and B belong to the cycle
        LogicFlow f = flow(List.of("X", "A", "B"),
                GraphEdge.of("X", "A"), GraphEdge.of("A", "B"), GraphEdge.of("B", "A"));
        assertEquals(List.of("A", "B"), CycleDetector.findCycle(FlowGraph.of(f)).orElseThrow());
    }

    @Test
    public void testDiamondIsAcyclic() {
        LogicFlow f = flow(List.of("A", "B", "C", "D"),
                GraphEdge.of("A", "B"), GraphEdge.of("A", "C"),
                GraphEdge.of("B", "D"), GraphEdge.of("C", "D"));
        assertFalse(CycleDetector.findCycle(FlowGraph.of(f)).isPresent());
    }

    @Test
    public void testDeepChainDoesNotOverflow() {
        int n = 50_000;
        FlowGraph.Builder b = FlowGraph.builder();
        for (int i = 0; i < n; i++)
            b.addNode("n" + i);
        for (int i = 1; i < n; i++)
            b.addEdge("n" + (i - 1), "n" + i);
        b.addEdge("n" + (n - 1), "n0");

        List<String> cycle = CycleDetector.findCycle(b.build()).orElseThrow();
        assertEquals(n, cycle.size());
        assertEquals("n0", cycle.get(0));
    }
}
