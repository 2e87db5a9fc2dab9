package com.trading.flowgen.graph;

import com.trading.flowgen.api.TemplateLookup;
import com.trading.flowgen.template.NodeTemplate;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import lombok.extern.log4j.Log4j2;

/**
 * Structural and semantic validation of a {@link LogicFlow}.
 *
 * <p>
 * Steps, stopping as soon as a structural defect makes later steps meaningless:
 * <ol>
 * <li>Shape: lists present, no null elements, node ids present and unique,
 * size limits respected.</li>
 * <li>References: every template id resolves (all failures collected).</li>
 * <li>Edges: both endpoints exist (all dangling edges collected).</li>
 * <li>Cycles: DFS, only when steps 1-3 passed.</li>
 * <li>Execution order: Kahn's algorithm on the DAG.</li>
 * <li>Port types: best-effort compatibility per edge.</li>
 * </ol>
 * Never throws for bad input; every problem comes back in the result.
 */
@Log4j2
public final class LogicFlowValidator {
    public static final int DEFAULT_MAX_NODES = 500;
    public static final int DEFAULT_MAX_EDGES = 2000;

    private final int maxNodes;
    private final int maxEdges;
    private final PortTypeChecker portTypeChecker = new PortTypeChecker();

    public LogicFlowValidator() {
        this(DEFAULT_MAX_NODES, DEFAULT_MAX_EDGES);
    }

    public LogicFlowValidator(int maxNodes, int maxEdges) {
        if (maxNodes <= 0 || maxEdges < 0)
            throw new IllegalArgumentException("Invalid flow limits: nodes=" + maxNodes + " edges=" + maxEdges);
        this.maxNodes = maxNodes;
        this.maxEdges = maxEdges;
    }

    public FlowValidationResult validate(LogicFlow flow, TemplateLookup lookup) {
        log.debug("Validating logic flow");

        // 1. Shape
        Optional<FlowIssue> shape = checkShape(flow);
        if (shape.isPresent()) {
            log.info("Logic flow validation: FAILED (malformed: {})", shape.get().message());
            return FlowValidationResult.structuralFailure(shape.get());
        }

        List<FlowIssue> errors = new ArrayList<>();
        List<FlowIssue> warnings = new ArrayList<>();

        // 2. Template references
        Map<String, NodeTemplate> templates = new LinkedHashMap<>();
        for (GraphNode node : flow.nodes()) {
            if (!node.hasTemplateId()) {
                warnings.add(FlowIssue.nodeWarning(FlowIssue.Code.MISSING_TEMPLATE_ID, node.nodeId(),
                        "Node " + node.nodeId() + " has no template_id and will be skipped"));
                continue;
            }
            Optional<NodeTemplate> template = lookup.getTemplate(node.templateId());
            if (template.isPresent()) {
                templates.put(node.nodeId(), template.get());
            } else {
                errors.add(FlowIssue.nodeError(FlowIssue.Code.TEMPLATE_NOT_FOUND, node.nodeId(),
                        "Template not found: " + node.templateId()));
            }
        }

        // 3. Edge referential integrity
        FlowGraph graph = null;
        try {
            graph = FlowGraph.of(flow);
        } catch (LogicFlowException e) {
            errors.addAll(danglingEdges(flow));
            if (errors.isEmpty())
                errors.add(FlowIssue.error(FlowIssue.Code.MALFORMED_FLOW, e.getMessage()));
        }

        // 4 + 5. Cycles, then execution order
        List<String> order = List.of();
        if (errors.isEmpty()) {
            Optional<List<String>> cycle = CycleDetector.findCycle(graph);
            if (cycle.isPresent()) {
                log.warn("Circular dependency detected: {}", cycle.get());
                errors.add(FlowIssue.cycle(cycle.get()));
            } else {
                order = TopologicalOrder.of(graph).nodeIds();
            }
        }

        // 6. Port types
        if (graph != null)
            errors.addAll(portTypeChecker.check(flow, lookup));

        if (graph != null && flow.nodes().size() > 1)
            warnings.addAll(isolatedNodes(flow));

        FlowMetadata metadata = new FlowMetadata(flow.nodes().size(), flow.edges().size(),
                countKinds(flow, templates), order);
        FlowValidationResult result = new FlowValidationResult(errors, warnings, metadata);
        log.info("Logic flow validation: {} ({} errors, {} warnings)",
                result.isValid() ? "PASSED" : "FAILED", errors.size(), warnings.size());
        return result;
    }

    private Optional<FlowIssue> checkShape(LogicFlow flow) {
        if (flow == null)
            return Optional.of(FlowIssue.error(FlowIssue.Code.MALFORMED_FLOW, "Logic flow is missing"));
        if (flow.nodes() == null)
            return Optional.of(FlowIssue.error(FlowIssue.Code.MALFORMED_FLOW, "Logic flow 'nodes' must be a list"));
        if (flow.edges() == null)
            return Optional.of(FlowIssue.error(FlowIssue.Code.MALFORMED_FLOW, "Logic flow 'edges' must be a list"));
        if (flow.nodes().size() > maxNodes)
            return Optional.of(FlowIssue.error(FlowIssue.Code.FLOW_TOO_LARGE,
                    "Logic flow has " + flow.nodes().size() + " nodes, limit is " + maxNodes));
        if (flow.edges().size() > maxEdges)
            return Optional.of(FlowIssue.error(FlowIssue.Code.FLOW_TOO_LARGE,
                    "Logic flow has " + flow.edges().size() + " edges, limit is " + maxEdges));

        Set<String> seen = new HashSet<>();
        for (int i = 0; i < flow.nodes().size(); i++) {
            GraphNode node = flow.nodes().get(i);
            if (node == null)
                return Optional.of(FlowIssue.error(FlowIssue.Code.MALFORMED_FLOW,
                        "Logic flow node at index " + i + " is null"));
            if (node.nodeId() == null || node.nodeId().isBlank())
                return Optional.of(FlowIssue.error(FlowIssue.Code.MALFORMED_FLOW,
                        "Logic flow node at index " + i + " has no id"));
            if (!seen.add(node.nodeId()))
                return Optional.of(FlowIssue.nodeError(FlowIssue.Code.DUPLICATE_NODE, node.nodeId(),
                        "Duplicate node id: " + node.nodeId()));
        }
        for (int i = 0; i < flow.edges().size(); i++) {
            if (flow.edges().get(i) == null)
                return Optional.of(FlowIssue.error(FlowIssue.Code.MALFORMED_FLOW,
                        "Logic flow edge at index " + i + " is null"));
        }
        return Optional.empty();
    }

    private static List<FlowIssue> danglingEdges(LogicFlow flow) {
        Set<String> ids = new HashSet<>(flow.nodeIds());
        List<FlowIssue> issues = new ArrayList<>();
        for (GraphEdge edge : flow.edges()) {
            if (!ids.contains(edge.sourceNodeId())) {
                issues.add(FlowIssue.edgeError(FlowIssue.Code.DANGLING_EDGE, edge.label(),
                        "Edge references non-existent source node: " + edge.sourceNodeId()));
            }
            if (!ids.contains(edge.targetNodeId())) {
                issues.add(FlowIssue.edgeError(FlowIssue.Code.DANGLING_EDGE, edge.label(),
                        "Edge references non-existent target node: " + edge.targetNodeId()));
            }
        }
        return issues;
    }

    private static List<FlowIssue> isolatedNodes(LogicFlow flow) {
        Set<String> connected = new HashSet<>();
        for (GraphEdge e : flow.edges()) {
            connected.add(e.sourceNodeId());
            connected.add(e.targetNodeId());
        }
        List<FlowIssue> issues = new ArrayList<>();
        for (GraphNode node : flow.nodes()) {
            if (!connected.contains(node.nodeId())) {
                issues.add(FlowIssue.nodeWarning(FlowIssue.Code.ISOLATED_NODE, node.nodeId(),
                        "Node " + node.nodeId() + " is not connected to any other node"));
            }
        }
        return issues;
    }

    private static Map<String, Integer> countKinds(LogicFlow flow, Map<String, NodeTemplate> templates) {
        Map<String, Integer> kinds = new LinkedHashMap<>();
        for (GraphNode node : flow.nodes()) {
            NodeTemplate t = templates.get(node.nodeId());
            String kind = t != null ? t.getKind().name()
                    : node.type() != null && !node.type().isBlank() ? node.type() : "UNKNOWN";
            kinds.merge(kind, 1, Integer::sum);
        }
        return kinds;
    }
}
