package com.trading.flowgen.codegen;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes {@code {{placeholder}}} markers in a node snippet.
 *
 * <p>
 * Placeholders:
 * <ul>
 * <li>{@code {{out}}}, {@code {{in}}}, {@code {{in:port}}}: variable names
 * wired by the generator;</li>
 * <li>{@code {{node_id}}}, {@code {{display_name}}}: string literals;</li>
 * <li>{@code {{param}}}: the parameter value as a Python literal;</li>
 * <li>{@code {{param|ident}}}: the parameter value as a checked identifier.</li>
 * </ul>
 * Any other name is a template bug and raises {@link TemplateRenderException}.
 */
public final class TemplateRenderer {
    static final String DEFAULT_INPUT = "close";

    private static final Pattern PLACEHOLDER = Pattern.compile(
            "\\{\\{\\s*([A-Za-z_][A-Za-z0-9_]*)(?::([A-Za-z_][A-Za-z0-9_]*))?\\s*(?:\\|\\s*([A-Za-z_]+)\\s*)?\\}\\}");

    public String render(String snippet, RenderContext ctx) {
        String unmatched = PLACEHOLDER.matcher(snippet).replaceAll("");
        int stray = unmatched.indexOf("{{");
        if (stray >= 0)
            throw new TemplateRenderException(ctx.templateId(), "malformed placeholder near '"
                    + unmatched.substring(stray, Math.min(unmatched.length(), stray + 20)) + "'");

        Matcher m = PLACEHOLDER.matcher(snippet);
        StringBuilder sb = new StringBuilder(snippet.length() + 32);
        while (m.find()) {
            String value = resolve(m.group(1), m.group(2), m.group(3), ctx);
            m.appendReplacement(sb, Matcher.quoteReplacement(value));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    /** Ports named by {@code {{in:port}}} that have no incoming edge and fall back to {@code close}. */
    public Set<String> unwiredPorts(String snippet, RenderContext ctx) {
        Set<String> out = new LinkedHashSet<>();
        Matcher m = PLACEHOLDER.matcher(snippet);
        while (m.find()) {
            String port = m.group(2);
            if (port != null && m.group(1).equals("in") && !ctx.portInputs().containsKey(port))
                out.add(port);
        }
        return out;
    }

    private String resolve(String name, String port, String filter, RenderContext ctx) {
        if (port != null) {
            if (!name.equals("in"))
                throw new TemplateRenderException(ctx.templateId(), "unknown placeholder {{" + name + ":" + port + "}}");
            return ctx.portInputs().getOrDefault(port, DEFAULT_INPUT);
        }
        switch (name) {
            case "out":
                return ctx.outputVar();
            case "in":
                return ctx.primaryInput() != null ? ctx.primaryInput() : DEFAULT_INPUT;
            case "node_id":
                return PythonLiterals.string(ctx.nodeId());
            case "display_name":
                return PythonLiterals.string(ctx.label());
            default:
                break;
        }
        if (!ctx.parameters().containsKey(name))
            throw new TemplateRenderException(ctx.templateId(), "unknown placeholder {{" + name + "}}");
        Object value = ctx.parameters().get(name);
        try {
            if (filter == null)
                return PythonLiterals.literal(value);
            if (filter.equals("ident"))
                return PythonLiterals.identifier(value);
        } catch (IllegalArgumentException e) {
            throw new TemplateRenderException(ctx.templateId(), "parameter '" + name + "': " + e.getMessage());
        }
        throw new TemplateRenderException(ctx.templateId(), "unknown filter |" + filter);
    }
}
