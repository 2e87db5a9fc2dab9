package com.trading.flowgen.security.ast;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Consumer;

/**
 * Breadth-first traversal over a syntax tree, root first.
 */
public final class PyTreeWalker {
    private PyTreeWalker() {
        // Utility class
    }

    public static void walk(PyNode root, Consumer<? super PyNode> visitor) {
        Deque<PyNode> queue = new ArrayDeque<>();
        queue.add(root);
        while (!queue.isEmpty()) {
            PyNode n = queue.poll();
            visitor.accept(n);
            queue.addAll(n.children());
        }
    }

    public static List<PyNode> nodes(PyNode root) {
        List<PyNode> out = new ArrayList<>();
        walk(root, out::add);
        return out;
    }

    /** All nodes of the given type, in traversal order. */
    public static <T extends PyNode> List<T> nodesOfType(PyNode root, Class<T> type) {
        List<T> out = new ArrayList<>();
        walk(root, n -> {
            if (type.isInstance(n))
                out.add(type.cast(n));
        });
        return out;
    }
}
