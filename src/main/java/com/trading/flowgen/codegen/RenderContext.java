package com.trading.flowgen.codegen;

import java.util.Map;

/**
 * Values available to one node's snippet.
 *
 * @param outputVar   variable the node assigns, {@code {{out}}}
 * @param primaryInput variable of the first upstream node, {@code {{in}}}
 * @param portInputs  upstream variables by target port, {@code {{in:port}}}
 * @param parameters  template defaults overlaid with explicit node values
 */
public record RenderContext(String templateId, String nodeId, String label, String outputVar, String primaryInput,
        Map<String, String> portInputs, Map<String, Object> parameters) {

    public RenderContext {
        portInputs = Map.copyOf(portInputs);
    }
}
