package com.trading.flowgen.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import lombok.extern.log4j.Log4j2;

/**
 * Depth-first cycle search over a {@link FlowGraph}.
 *
 * <p>
 * Roots are visited in flow order and successors in edge order, so a given
 * flow always reports the same cycle. The search keeps an explicit stack
 * rather than recursing, which keeps adversarially deep graphs from
 * exhausting the thread stack.
 */
@Log4j2
public final class CycleDetector {
    private static final byte UNVISITED = 0, ON_STACK = 1, DONE = 2;

    private CycleDetector() {
        // Utility class
    }

    /**
     * Returns the first cycle found, as the node ids on the DFS path from the
     * re-entered node to the node closing the cycle; empty for a DAG.
     */
    public static Optional<List<String>> findCycle(FlowGraph graph) {
        int n = graph.nodeCount();
        byte[] state = new byte[n];
        int[] path = new int[n];
        int[] nextChild = new int[n];
        int[] pathPos = new int[n];

        for (int root = 0; root < n; root++) {
            if (state[root] != UNVISITED)
                continue;
            int depth = 0;
            path[depth] = root;
            pathPos[root] = depth;
            nextChild[root] = 0;
            state[root] = ON_STACK;

            while (depth >= 0) {
                int curr = path[depth];
                if (nextChild[curr] < graph.successorCount(curr)) {
                    int child = graph.successor(curr, nextChild[curr]++);
                    if (state[child] == ON_STACK) {
                        List<String> cycle = new ArrayList<>(depth - pathPos[child] + 1);
                        for (int i = pathPos[child]; i <= depth; i++)
                            cycle.add(graph.id(path[i]));
                        log.debug("Cycle detected: {}", cycle);
                        return Optional.of(cycle);
                    }
                    if (state[child] == UNVISITED) {
                        state[child] = ON_STACK;
                        nextChild[child] = 0;
                        path[++depth] = child;
                        pathPos[child] = depth;
                    }
                } else {
                    state[curr] = DONE;
                    depth--;
                }
            }
        }
        return Optional.empty();
    }
}
