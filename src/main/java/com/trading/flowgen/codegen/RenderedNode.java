package com.trading.flowgen.codegen;

import java.util.List;

/**
 * Source fragment for one node, unindented.
 *
 * @param placeholder true when no snippet existed and a stub was emitted
 * @param unwiredPorts named input ports with no incoming edge
 */
record RenderedNode(String nodeId, String source, List<String> imports, boolean placeholder,
        List<String> unwiredPorts) {
}
