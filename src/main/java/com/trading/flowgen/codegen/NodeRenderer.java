package com.trading.flowgen.codegen;

import com.trading.flowgen.api.NodeKind;
import com.trading.flowgen.template.CodeTemplate;
import com.trading.flowgen.template.NodeTemplate;

import java.util.List;

/**
 * Chooses and renders the snippet for a node by kind.
 *
 * <p>
 * A template's own snippet wins. Otherwise the kind's default is used, and
 * kinds without a default get a stub that leaves the output as {@code None}.
 * Each kind binds its output into the decision state of the strategy.
 */
final class NodeRenderer {
    private final TemplateRenderer renderer = new TemplateRenderer();

    RenderedNode render(NodeTemplate template, RenderContext ctx) {
        NodeKind kind = template.getKind();
        CodeTemplate code = template.getCodeTemplate();
        String snippet = code != null && code.hasSnippet() ? code.snippet() : defaultSnippet(kind);
        boolean placeholder = snippet == null;
        if (placeholder)
            snippet = placeholderSnippet(kind);

        StringBuilder sb = new StringBuilder();
        sb.append("# ").append(PythonLiterals.comment(template.label()))
                .append(" (").append(PythonLiterals.comment(ctx.nodeId())).append(")\n");
        sb.append(renderer.render(snippet, ctx).strip()).append('\n');
        if (!placeholder) {
            String binding = binding(kind, ctx.outputVar());
            if (binding != null)
                sb.append(binding).append('\n');
        }
        List<String> imports = code == null ? List.of() : code.imports();
        return new RenderedNode(ctx.nodeId(), sb.toString(), imports, placeholder,
                List.copyOf(renderer.unwiredPorts(snippet, ctx)));
    }

    static String defaultSnippet(NodeKind kind) {
        return switch (kind) {
            case CONDITION -> "{{out}} = _compare({{in}}, {{operator}}, {{threshold}})";
            case SIGNAL -> "{{out}} = _to_signal({{in}}, {{signal_type}})";
            case POSITION -> "{{out}} = {{size}}";
            case STOP_LOSS, STOP_PROFIT -> "{{out}} = {{percent}}";
            default -> null;
        };
    }

    /** Statement wiring a node's output into the strategy decision, or null. */
    static String binding(NodeKind kind, String var) {
        return switch (kind) {
            case SIGNAL -> "signals.append(" + var + ")";
            case POSITION -> "position_size = " + var;
            case STOP_LOSS -> "stop_loss = " + var;
            case STOP_PROFIT -> "take_profit = " + var;
            case RISK_MANAGEMENT -> "risk_checks.append(" + var + ")";
            default -> null;
        };
    }

    private static String placeholderSnippet(NodeKind kind) {
        return "# TODO: Implement " + kind + " logic (requires manual completion)\n{{out}} = None";
    }
}
