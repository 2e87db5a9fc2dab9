package com.trading.flowgen.codegen;

import org.junit.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.Assert.*;

public class TemplateRendererTest {
    private final TemplateRenderer renderer = new TemplateRenderer();

    private static RenderContext ctx(String primaryInput) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("period", 20);
        params.put("side", "BUY");
        params.put("column", "high");
        params.put("quoted", "say \"hi\"");
        return new RenderContext("tpl", "n1", "My Node", "n3_n1", primaryInput, Map.of("fast", "n0_fast"), params);
    }

    @Test
    public void testWiringPlaceholders() {
        assertEquals("n3_n1 = n2_src.rolling(window=20).mean()",
                renderer.render("{{out}} = {{in}}.rolling(window={{period}}).mean()", ctx("n2_src")));
    }

    @Test
    public void testMissingInputsFallBackToClose() {
        assertEquals("n3_n1 = close", renderer.render("{{out}} = {{in}}", ctx(null)));
        assertEquals("n0_fast - close", renderer.render("{{in:fast}} - {{in:slow}}", ctx(null)));
    }

    @Test
    public void testParametersRenderAsLiterals() {
        RenderContext c = ctx("x");
        assertEquals("side = \"BUY\"", renderer.render("side = {{side}}", c));
        assertEquals("q = \"say \\\"hi\\\"\"", renderer.render("q = {{ quoted }}", c));
        assertEquals("data[\"n1\"] # \"My Node\"", renderer.render("data[{{node_id}}] # {{display_name}}", c));
    }

    @Test
    public void testIdentFilter() {
        assertEquals("v = data.high", renderer.render("v = data.{{column|ident}}", ctx("x")));
        try {
            renderer.render("v = data.{{quoted|ident}}", ctx("x"));
            fail();
        } catch (TemplateRenderException e) {
            assertEquals("tpl", e.templateId());
            assertTrue(e.getMessage(), e.getMessage().startsWith("Template tpl: parameter 'quoted'"));
        }
    }

    @Test
    public void testUnknownPlaceholder() {
        try {
            renderer.render("{{out}} = {{window}}", ctx("x"));
            fail();
        } catch (TemplateRenderException e) {
            assertEquals("Template tpl: unknown placeholder {{window}}", e.getMessage());
        }
    }

    @Test(expected = TemplateRenderException.class)
    public void testUnknownFilter() {
        renderer.render("{{period|upper}}", ctx("x"));
    }

    @Test(expected = TemplateRenderException.class)
    public void testPortOnlyAllowedForInputs() {
        renderer.render("{{out:fast}}", ctx("x"));
    }

    @Test(expected = TemplateRenderException.class)
    public void testMalformedPlaceholder() {
        renderer.render("{{out}} = {{ period", ctx("x"));
    }

    @Test
    public void testBracesInParameterValuesAreNotPlaceholders() {
        Map<String, Object> params = Map.of("label", "{{out}}");
        RenderContext c = new RenderContext("tpl", "n", "n", "v", null, Map.of(), params);
        assertEquals("s = \"{{out}}\"", renderer.render("s = {{label}}", c));
    }
}
