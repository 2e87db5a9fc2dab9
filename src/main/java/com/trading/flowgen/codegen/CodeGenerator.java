package com.trading.flowgen.codegen;

import com.trading.flowgen.api.TemplateLookup;
import com.trading.flowgen.graph.GraphEdge;
import com.trading.flowgen.graph.GraphNode;
import com.trading.flowgen.graph.LogicFlow;
import com.trading.flowgen.graph.TopologicalOrder;
import com.trading.flowgen.template.NodeTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.regex.Pattern;

import lombok.extern.log4j.Log4j2;

/**
 * Renders a validated logic flow into one strategy module.
 *
 * <p>
 * Nodes are rendered in topological order so every variable is assigned
 * before a downstream node reads it. Nodes without a resolvable template are
 * skipped with a warning. The resulting record is {@code PENDING}; the
 * syntax and security checks decide its final status.
 *
 * <p>
 * Output is deterministic: the same flow, parameters and templates always
 * produce the same text and therefore the same hash.
 */
@Log4j2
public final class CodeGenerator {
    public static final String DEFAULT_CLASS_NAME = "GeneratedStrategy";

    static final List<String> BASE_IMPORTS = List.of("numpy as np", "pandas as pd");

    private static final Pattern IMPORT_SPEC = Pattern.compile(
            "[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)*( as [A-Za-z_][A-Za-z0-9_]*)?");

    private static final String INDENT = "        ";

    private static final String HELPERS = """
            _COMPARATORS = {
                ">": lambda a, b: a > b,
                ">=": lambda a, b: a >= b,
                "<": lambda a, b: a < b,
                "<=": lambda a, b: a <= b,
                "==": lambda a, b: a == b,
                "!=": lambda a, b: a != b,
            }


            def _last(value):
                if isinstance(value, pd.Series):
                    return value.iloc[-1] if len(value) else float("nan")
                return value


            def _compare(left, operator, right):
                return bool(_COMPARATORS[operator](_last(left), _last(right)))


            def _crossed(fast, slow, direction):
                if not isinstance(fast, pd.Series) or not isinstance(slow, pd.Series):
                    return False
                if len(fast) < 2 or len(slow) < 2:
                    return False
                above_now = fast.iloc[-1] > slow.iloc[-1]
                above_before = fast.iloc[-2] > slow.iloc[-2]
                if direction == "above":
                    return bool(above_now and not above_before)
                return bool(above_before and not above_now)


            def _to_signal(condition, signal_type):
                if not bool(_last(condition)):
                    return 0
                return 1 if signal_type == "BUY" else -1


            def _combine(signals):
                total = sum(signals)
                if total > 0:
                    return "BUY"
                if total < 0:
                    return "SELL"
                return "HOLD"


            def _all_pass(checks):
                return all(bool(_last(check)) for check in checks)
            """;

    private static final String DECISION_STATE = """
            close = data["close"]
            signals = []
            risk_checks = []
            position_size = 0.0
            stop_loss = None
            take_profit = None
            """;

    private static final String DECISION_RESULT = """
            action = _combine(signals)
            if not _all_pass(risk_checks):
                action = "HOLD"
            return {
                "action": action,
                "position_size": position_size,
                "stop_loss": stop_loss,
                "take_profit": take_profit,
                "signals": signals,
            }
            """;

    private final String strategyClassName;
    private final NodeRenderer nodeRenderer = new NodeRenderer();

    public CodeGenerator() {
        this(DEFAULT_CLASS_NAME);
    }

    public CodeGenerator(String strategyClassName) {
        if (!PythonLiterals.isIdentifier(strategyClassName))
            throw new IllegalArgumentException("Invalid strategy class name: " + strategyClassName);
        this.strategyClassName = strategyClassName;
    }

    /**
     * @throws com.trading.flowgen.graph.CircularDependencyException if the flow has a cycle
     * @throws com.trading.flowgen.graph.LogicFlowException          if the flow is malformed
     * @throws TemplateRenderException                               if a snippet cannot be rendered
     */
    public CodeGenerationRecord generate(GenerationRequest request, TemplateLookup lookup) {
        LogicFlow flow = request.flow();
        TopologicalOrder order = TopologicalOrder.of(flow);
        log.debug("Generating code for instance {} ({} nodes)", request.instanceId(), order.size());

        Map<String, List<GraphEdge>> incoming = incomingEdges(flow);
        Map<String, String> rendered = new LinkedHashMap<>();
        Map<String, Map<String, Object>> effectiveParameters = new LinkedHashMap<>();
        Set<String> imports = new TreeSet<>();
        List<String> fragments = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        BASE_IMPORTS.forEach(i -> imports.add(importLine(i, "base")));

        for (int pos = 0; pos < order.size(); pos++) {
            String nodeId = order.nodeAt(pos);
            GraphNode node = flow.node(nodeId).orElseThrow();
            if (!node.hasTemplateId()) {
                warn(warnings, "Node " + nodeId + " has no template_id; skipped");
                continue;
            }
            Optional<NodeTemplate> found = lookup.getTemplate(node.templateId());
            if (found.isEmpty()) {
                warn(warnings, "Template " + node.templateId() + " not found for node " + nodeId + "; skipped");
                continue;
            }
            NodeTemplate template = found.get();

            Map<String, Object> params = new LinkedHashMap<>(template.defaultParameters());
            params.putAll(request.parametersOf(nodeId));
            effectiveParameters.put(nodeId, params);

            String var = variableName(pos, nodeId);
            RenderContext ctx = inputs(template.getId(), nodeId, template.label(), var,
                    incoming.getOrDefault(nodeId, List.of()), rendered, params);
            RenderedNode r = nodeRenderer.render(template, ctx);
            if (r.placeholder()) {
                String w = "Node " + nodeId + " (" + template.getKind() + ") has no code template;"
                        + " emitted placeholder requiring manual completion";
                log.warn(w);
                warnings.add(w);
            }
            for (String port : r.unwiredPorts())
                warn(warnings, "Node " + nodeId + " input port '" + port + "' has no incoming edge; using "
                        + TemplateRenderer.DEFAULT_INPUT);
            for (String spec : r.imports())
                imports.add(importLine(spec, template.getId()));
            fragments.add(r.source());
            rendered.put(nodeId, var);
        }

        String code = compose(order.nodeIds(), imports, fragments, effectiveParameters);
        String hash = CodeHasher.hash(code);
        log.info("Generated {} node(s) for instance {} (hash {}, {} warning(s))",
                fragments.size(), request.instanceId(), hash.substring(0, 12), warnings.size());

        return CodeGenerationRecord.builder()
                .id(UUID.randomUUID().toString())
                .instanceId(request.instanceId())
                .ownerId(request.ownerId())
                .logicFlowSnapshot(flow)
                .parametersSnapshot(request.parameters())
                .generatedCode(code)
                .codeHash(hash)
                .warnings(warnings)
                .executionOrder(order.nodeIds())
                .build();
    }

    private static void warn(List<String> warnings, String message) {
        log.warn(message);
        warnings.add(message);
    }

    /** Resolves {@code {{in}}} and {@code {{in:port}}} from edges whose source was rendered. */
    private static RenderContext inputs(String templateId, String nodeId, String label, String var,
            List<GraphEdge> edges, Map<String, String> rendered, Map<String, Object> params) {
        String primary = null;
        Map<String, String> ports = new LinkedHashMap<>();
        for (GraphEdge e : edges) {
            String source = rendered.get(e.sourceNodeId());
            if (source == null)
                continue;
            if (primary == null)
                primary = source;
            if (e.targetPort() != null)
                ports.putIfAbsent(e.targetPort(), source);
        }
        return new RenderContext(templateId, nodeId, label, var, primary, ports, params);
    }

    private static Map<String, List<GraphEdge>> incomingEdges(LogicFlow flow) {
        Map<String, List<GraphEdge>> incoming = new LinkedHashMap<>();
        for (GraphEdge e : flow.edges())
            incoming.computeIfAbsent(e.targetNodeId(), k -> new ArrayList<>()).add(e);
        return incoming;
    }

    /** {@code n<position>_<id>}: unique per flow even when sanitized ids collide. */
    static String variableName(int position, String nodeId) {
        return "n" + position + "_" + nodeId.replaceAll("[^A-Za-z0-9_]", "_");
    }

    private static String importLine(String spec, String templateId) {
        String s = spec.strip();
        if (!IMPORT_SPEC.matcher(s).matches())
            throw new TemplateRenderException(templateId, "invalid import '" + spec + "'");
        return "import " + s;
    }

    private String compose(List<String> executionOrder, Set<String> imports, List<String> fragments,
            Map<String, Map<String, Object>> parameters) {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("# Generated strategy module. Do not edit by hand.\n");
        sb.append("# Execution order: ")
                .append(executionOrder.isEmpty() ? "(empty)"
                        : PythonLiterals.comment(String.join(" -> ", executionOrder)))
                .append('\n');
        for (String line : imports)
            sb.append(line).append('\n');
        sb.append("\n\n").append(HELPERS).append("\n\n");

        sb.append("class ").append(strategyClassName).append(":\n");
        sb.append("    \"\"\"Strategy assembled from ").append(fragments.size()).append(" node(s).\"\"\"\n\n");
        sb.append("    PARAMETERS = ").append(parametersLiteral(parameters)).append("\n\n");
        sb.append("    def __init__(self, **params):\n");
        sb.append("        self.params = dict(self.PARAMETERS)\n");
        sb.append("        self.params.update(params)\n\n");
        sb.append("    def generate_trade_decision(self, data):\n");
        indent(sb, DECISION_STATE);
        sb.append('\n');
        if (fragments.isEmpty()) {
            sb.append(INDENT).append("# Logic flow has no nodes\n\n");
        } else {
            for (String fragment : fragments) {
                indent(sb, fragment);
                sb.append('\n');
            }
        }
        indent(sb, DECISION_RESULT);
        return sb.toString();
    }

    private static String parametersLiteral(Map<String, Map<String, Object>> parameters) {
        try {
            return PythonLiterals.literal(parameters);
        } catch (IllegalArgumentException e) {
            throw new CodeGenerationException("Cannot render parameters: " + e.getMessage(), e);
        }
    }

    private static void indent(StringBuilder sb, String block) {
        for (String line : block.split("\n", -1)) {
            if (line.isBlank())
                continue;
            sb.append(INDENT).append(line).append('\n');
        }
    }
}
