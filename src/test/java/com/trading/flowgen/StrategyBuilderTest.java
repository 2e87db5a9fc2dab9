package com.trading.flowgen;

import com.trading.flowgen.api.NodeKind;
import com.trading.flowgen.api.ValidationStatus;
import com.trading.flowgen.codegen.CodeGenerationRecord;
import com.trading.flowgen.codegen.GenerationRequest;
import com.trading.flowgen.dsl.FlowBuilder;
import com.trading.flowgen.graph.FlowIssue;
import com.trading.flowgen.graph.GraphNode;
import com.trading.flowgen.graph.LogicFlow;
import com.trading.flowgen.io.FlowGenConfig;
import com.trading.flowgen.io.InMemoryGenerationHistory;
import com.trading.flowgen.io.TemplateCatalogLoader;
import com.trading.flowgen.param.ParameterError;
import com.trading.flowgen.security.SecurityPolicy;
import com.trading.flowgen.template.CodeTemplate;
import com.trading.flowgen.template.NodeTemplate;
import com.trading.flowgen.template.NodeTemplateRegistry;
import org.junit.Before;
import org.junit.Test;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class StrategyBuilderTest {
    private static final NodeTemplateRegistry CATALOG = TemplateCatalogLoader.systemCatalog();

    private InMemoryGenerationHistory history;
    private StrategyBuilder builder;

    @Before
    public void setUp() {
        history = new InMemoryGenerationHistory();
        builder = new StrategyBuilder(CATALOG, history);
    }

    private static LogicFlow smaThresholdBuy() {
        FlowBuilder f = FlowBuilder.create();
        f.node("sma", "sma");
        f.node("cond", "threshold");
        f.node("sig", "buy_signal");
        f.edge("sma", "cond").edge("cond", "sig");
        return f.build();
    }

    private static GenerationRequest request(String instanceId, Map<String, Map<String, Object>> params) {
        return new GenerationRequest(instanceId, "owner-1", smaThresholdBuy(), params);
    }

    @Test
    public void testValidFlowIsGeneratedAndSaved() {
        GenerationOutcome outcome = builder.build(request("inst-1", Map.of("sma", Map.of("period", 30))));

        assertFalse(outcome.isRejected());
        assertTrue(outcome.isSuccess());
        assertFalse(outcome.reused());
        assertEquals(ValidationStatus.VALID, outcome.status().orElseThrow());
        assertTrue(outcome.flowValidation().isValid());
        assertTrue(outcome.parameterErrors().isEmpty());

        CodeGenerationRecord r = outcome.record();
        assertEquals("owner-1", r.getOwnerId());
        assertTrue(r.getGeneratedCode().contains("rolling(window=30)"));
        assertEquals(1, history.count("inst-1"));
        assertSame(r, history.findById(r.getId()).orElseThrow());
    }

    @Test
    public void testInvalidFlowIsRejected() {
        FlowBuilder f = FlowBuilder.create();
        f.node("a", "sma");
        f.node("b", "sma");
        f.edge("a", "b").edge("b", "a");
        GenerationOutcome outcome = builder.build(GenerationRequest.of("inst-1", f.build()));

        assertTrue(outcome.isRejected());
        assertFalse(outcome.isSuccess());
        assertFalse(outcome.status().isPresent());
        assertTrue(outcome.flowValidation().hasError(FlowIssue.Code.CIRCULAR_DEPENDENCY));
        assertEquals(0, history.size());
    }

    @Test
    public void testInvalidParametersAreRejected() {
        GenerationOutcome outcome = builder.build(request("inst-1", Map.of("sma", Map.of("period", -5))));

        assertTrue(outcome.isRejected());
        assertTrue(outcome.flowValidation().isValid());
        assertEquals(1, outcome.parameterErrors().size());
        ParameterError e = outcome.parameterErrors().get("sma").errors().get(0);
        assertEquals(ParameterError.Code.BELOW_MINIMUM, e.code());
        assertEquals("Parameter 'period' value -5 is below minimum 1", e.message());
        assertEquals(0, history.size());
    }

    @Test
    public void testParameterErrorsKeepFlowOrder() {
        FlowBuilder f = FlowBuilder.create();
        f.node("slow", "sma");
        f.node("fast", "ema");
        f.node("mid", "rsi");
        f.param("slow", "period", 0);
        f.param("fast", "period", 0);
        f.param("mid", "period", 0);
        GenerationOutcome outcome = builder.build(new GenerationRequest("inst-1", null, f.build(), f.parameters()));

        assertTrue(outcome.isRejected());
        assertEquals(List.of("slow", "fast", "mid"), List.copyOf(outcome.parameterErrors().keySet()));
    }

    @Test
    public void testStrategyRulesAreEnforcedWhenConfigured() {
        FlowGenConfig config = new FlowGenConfig();
        config.setEnforceStrategyRules(true);
        StrategyBuilder strict = new StrategyBuilder(CATALOG, history, SecurityPolicy.defaults(), config);

        GenerationOutcome outcome = strict.build(request("inst-1", Map.of()));
        assertTrue(outcome.isRejected());
        assertTrue(outcome.flowValidation().hasError(FlowIssue.Code.MISSING_SELL_SIGNAL));
        assertEquals(List.of("sma", "cond", "sig"), outcome.flowValidation().metadata().executionOrder());
        assertEquals(0, history.size());

        FlowBuilder f = FlowBuilder.create();
        f.node("sma", "sma");
        f.node("up", "threshold");
        f.node("down", "threshold");
        f.node("buy", "buy_signal");
        f.node("sell", "sell_signal");
        f.edge("sma", "up").edge("sma", "down").edge("up", "buy").edge("down", "sell");
        f.param("down", "operator", "<");
        GenerationOutcome complete = strict.build(new GenerationRequest("inst-1", null, f.build(), f.parameters()));
        assertTrue(complete.isSuccess());
    }

    @Test
    public void testIdenticalCodeIsReused() {
        GenerationOutcome first = builder.build(request("inst-1", Map.of()));
        GenerationOutcome second = builder.build(request("inst-1", Map.of()));

        assertFalse(first.reused());
        assertTrue(second.reused());
        assertEquals(first.record().getId(), second.record().getId());
        assertEquals(1, history.count("inst-1"));

        // an explicit default renders the same code
        GenerationOutcome third = builder.build(request("inst-1", Map.of("sma", Map.of("period", 20))));
        assertTrue(third.reused());

        GenerationOutcome changed = builder.build(request("inst-1", Map.of("sma", Map.of("period", 21))));
        assertFalse(changed.reused());
        assertEquals(2, history.count("inst-1"));
    }

    @Test
    public void testReuseIsScopedToInstance() {
        GenerationOutcome a = builder.build(request("inst-1", Map.of()));
        GenerationOutcome b = builder.build(request("inst-2", Map.of()));

        assertFalse(b.reused());
        assertEquals(a.record().getCodeHash(), b.record().getCodeHash());
        assertNotEquals(a.record().getId(), b.record().getId());
        assertEquals(2, history.size());
    }

    @Test
    public void testUnsafeTemplateIsSavedAsSecurityError() {
        NodeTemplate sneaky = NodeTemplate.builder().id("sneaky").kind(NodeKind.INDICATOR)
                .codeTemplate(CodeTemplate.of("{{out}} = os.getcwd()", "os")).build();
        StrategyBuilder b = new StrategyBuilder(NodeTemplateRegistry.of(sneaky), history);

        GenerationOutcome outcome = b.build(GenerationRequest.of("inst-1",
                LogicFlow.of(List.of(GraphNode.of("n", "sneaky")), List.of())));

        assertFalse(outcome.isRejected());
        assertFalse(outcome.isSuccess());
        assertEquals(ValidationStatus.SECURITY_ERROR, outcome.status().orElseThrow());
        assertFalse(outcome.record().getSecurityViolations().isEmpty());
        assertEquals(1, history.size());
    }

    @Test
    public void testWithDefaults() {
        StrategyBuilder defaults = StrategyBuilder.withDefaults();
        assertEquals(14, ((NodeTemplateRegistry) defaults.templates()).size());
        assertTrue(defaults.build(request("inst-1", Map.of())).isSuccess());
    }
}
