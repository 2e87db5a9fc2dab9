package com.trading.flowgen.graph;

import com.trading.flowgen.api.TemplateLookup;
import com.trading.flowgen.template.NodeTemplate;
import com.trading.flowgen.template.Port;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Best-effort check that each edge connects compatible value types.
 * <p>
 * A node's declared {@code outputType}/{@code inputType} wins over its
 * template's port declaration. An edge is only checked when both ends declare
 * a type; a typed end facing an untyped end passes silently, as does
 * {@value #ANY} on either end.
 */
public final class PortTypeChecker {
    /** Port type accepting any value. */
    public static final String ANY = "any";

    public List<FlowIssue> check(LogicFlow flow, TemplateLookup lookup) {
        Map<String, GraphNode> byId = new HashMap<>();
        for (GraphNode n : flow.nodes())
            byId.put(n.nodeId(), n);

        List<FlowIssue> issues = new ArrayList<>();
        for (GraphEdge edge : flow.edges()) {
            GraphNode source = byId.get(edge.sourceNodeId());
            GraphNode target = byId.get(edge.targetNodeId());
            if (source == null || target == null)
                continue;
            String out = outputType(source, edge.sourcePort(), lookup);
            String in = inputType(target, edge.targetPort(), lookup);
            if (out == null || in == null)
                continue;
            if (!compatible(out, in)) {
                issues.add(FlowIssue.edgeError(FlowIssue.Code.TYPE_MISMATCH, edge.label(),
                        "Type mismatch: " + source.nodeId() + " outputs " + out + ", but "
                                + target.nodeId() + " expects " + in));
            }
        }
        return issues;
    }

    static boolean compatible(String out, String in) {
        return out.equalsIgnoreCase(in) || ANY.equalsIgnoreCase(out) || ANY.equalsIgnoreCase(in);
    }

    static String outputType(GraphNode node, String port, TemplateLookup lookup) {
        if (isDeclared(node.outputType()))
            return node.outputType();
        return template(node, lookup)
                .flatMap(t -> t.outputPort(port))
                .map(Port::dataType)
                .filter(PortTypeChecker::isDeclared)
                .orElse(null);
    }

    static String inputType(GraphNode node, String port, TemplateLookup lookup) {
        if (isDeclared(node.inputType()))
            return node.inputType();
        return template(node, lookup)
                .flatMap(t -> t.inputPort(port))
                .map(Port::dataType)
                .filter(PortTypeChecker::isDeclared)
                .orElse(null);
    }

    private static Optional<NodeTemplate> template(GraphNode node, TemplateLookup lookup) {
        return node.hasTemplateId() ? lookup.getTemplate(node.templateId()) : Optional.empty();
    }

    private static boolean isDeclared(String type) {
        return type != null && !type.isBlank();
    }
}
