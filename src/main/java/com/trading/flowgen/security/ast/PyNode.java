package com.trading.flowgen.security.ast;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * A node of the parsed syntax tree.
 */
public interface PyNode {

    /** 1-based source line where the node starts. */
    int line();

    /** Direct child nodes, in source order. */
    List<PyNode> children();

    /**
     * Flattens nodes, collections of nodes and nulls into a child list.
     */
    static List<PyNode> childrenOf(Object... parts) {
        List<PyNode> out = new ArrayList<>();
        for (Object p : parts) {
            if (p instanceof PyNode n)
                out.add(n);
            else if (p instanceof Collection<?> c)
                for (Object o : c)
                    if (o instanceof PyNode n)
                        out.add(n);
        }
        return out;
    }
}
