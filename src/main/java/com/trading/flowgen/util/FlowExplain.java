package com.trading.flowgen.util;

import com.trading.flowgen.api.TemplateLookup;
import com.trading.flowgen.graph.FlowIssue;
import com.trading.flowgen.graph.FlowValidationResult;
import com.trading.flowgen.graph.GraphEdge;
import com.trading.flowgen.graph.GraphNode;
import com.trading.flowgen.graph.LogicFlow;
import com.trading.flowgen.graph.LogicFlowException;
import com.trading.flowgen.graph.TopologicalOrder;
import com.trading.flowgen.template.NodeTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Diagnostic renderings of a logic flow.
 *
 * <p>
 * <b>Usage:</b> intended for debugging sessions and error logs. The flow is
 * expected to have passed the shape checks of the validator; cyclic flows are
 * drawn in declaration order.
 */
public final class FlowExplain {
    private final LogicFlow flow;
    private final TemplateLookup lookup;

    public FlowExplain(LogicFlow flow, TemplateLookup lookup) {
        this.flow = Objects.requireNonNull(flow, "flow");
        this.lookup = Objects.requireNonNull(lookup, "lookup");
    }

    /**
     * Generates a Mermaid JS graph diagram: nodes in execution order labelled
     * with their kind, edges labelled with their ports.
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("graph TD;\n");

        // 1. Declare nodes in display order
        for (String nodeId : displayOrder()) {
            GraphNode node = flow.node(nodeId).orElseThrow();
            sb.append("  ").append(sanitize(nodeId))
                    .append("[\"").append(escape(nodeId)).append("<br/>").append(escape(kindOf(node)))
                    .append("\"];\n");
        }

        // 2. Declare all edges afterwards
        for (GraphEdge e : flow.edges()) {
            String label = portLabel(e);
            sb.append("  ").append(sanitize(e.sourceNodeId()));
            if (label != null)
                sb.append(" -- \"").append(escape(label)).append("\" --> ");
            else
                sb.append(" --> ");
            sb.append(sanitize(e.targetNodeId())).append(";\n");
        }
        return sb.toString();
    }

    /** Plain-text summary of a validation result for this flow. */
    public String report(FlowValidationResult result) {
        StringBuilder sb = new StringBuilder(512);
        sb.append("Logic flow: ").append(flow.nodes().size()).append(" nodes, ")
                .append(flow.edges().size()).append(" edges -> ")
                .append(result.isValid() ? "VALID" : "INVALID").append('\n');
        if (!result.metadata().executionOrder().isEmpty())
            sb.append("  Execution order: ").append(String.join(" -> ", result.metadata().executionOrder()))
                    .append('\n');
        for (Map.Entry<String, Integer> kind : result.metadata().nodeKinds().entrySet())
            sb.append("  ").append(kind.getKey()).append(": ").append(kind.getValue()).append('\n');
        for (FlowIssue e : result.errors())
            sb.append("  ERROR   ").append(describe(e)).append('\n');
        for (FlowIssue w : result.warnings())
            sb.append("  WARNING ").append(describe(w)).append('\n');
        return sb.toString();
    }

    private List<String> displayOrder() {
        try {
            return TopologicalOrder.of(flow).nodeIds();
        } catch (LogicFlowException e) {
            return new ArrayList<>(flow.nodeIds());
        }
    }

    private String kindOf(GraphNode node) {
        if (node.hasTemplateId()) {
            Optional<NodeTemplate> template = lookup.getTemplate(node.templateId());
            if (template.isPresent())
                return template.get().getKind().name();
        }
        return node.type() != null && !node.type().isBlank() ? node.type() : "UNKNOWN";
    }

    private static String portLabel(GraphEdge e) {
        if (e.sourcePort() == null && e.targetPort() == null)
            return null;
        return (e.sourcePort() != null ? e.sourcePort() : "") + " -> " + (e.targetPort() != null ? e.targetPort() : "");
    }

    private static String describe(FlowIssue issue) {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(issue.code()).append("] ").append(issue.message());
        if (issue.nodeId() != null)
            sb.append(" (node ").append(issue.nodeId()).append(')');
        if (issue.edgeId() != null)
            sb.append(" (edge ").append(issue.edgeId()).append(')');
        return sb.toString();
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9_]", "_");
    }

    private static String escape(String text) {
        return text.replace("\"", "#quot;");
    }
}
