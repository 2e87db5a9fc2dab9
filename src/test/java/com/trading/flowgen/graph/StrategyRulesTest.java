package com.trading.flowgen.graph;

import com.trading.flowgen.api.NodeKind;
import com.trading.flowgen.dsl.FlowBuilder;
import com.trading.flowgen.io.TemplateCatalogLoader;
import com.trading.flowgen.template.NodeTemplate;
import com.trading.flowgen.template.NodeTemplateRegistry;
import org.junit.Test;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class StrategyRulesTest {
    private static final NodeTemplateRegistry CATALOG = TemplateCatalogLoader.systemCatalog()
            .withCustomTemplate(NodeTemplate.builder().id("bare_position").kind(NodeKind.POSITION)
                    .ownerId("tester").build());

    private final StrategyRules rules = new StrategyRules();

    private static FlowBuilder buyAndSell() {
        FlowBuilder f = FlowBuilder.create();
        f.node("sma", "sma");
        f.node("up", "threshold");
        f.node("down", "threshold");
        f.node("buy", "buy_signal");
        f.node("sell", "sell_signal");
        f.edge("sma", "up").edge("sma", "down").edge("up", "buy").edge("down", "sell");
        return f;
    }

    private static List<FlowIssue.Code> codes(List<FlowIssue> issues) {
        return issues.stream().map(FlowIssue::code).toList();
    }

    @Test
    public void testCompleteStrategyPasses() {
        FlowBuilder f = buyAndSell();
        f.node("size", "fixed_fraction");
        f.node("stop", "percent_stop_loss");
        f.edge("buy", "size").edge("size", "stop");

        assertTrue(rules.check(f.build(), f.parameters(), CATALOG).isEmpty());
    }

    @Test
    public void testSignalsRequireBuyAndSell() {
        FlowBuilder f = FlowBuilder.create();
        f.node("sma", "sma");
        f.node("cond", "threshold");
        f.node("sig", "buy_signal");
        f.edge("sma", "cond").edge("cond", "sig");

        List<FlowIssue> errors = rules.checkSignals(f.build(), f.parameters(), CATALOG);
        assertEquals(List.of(FlowIssue.Code.MISSING_SELL_SIGNAL), codes(errors));
        assertEquals("Strategy must contain at least one SELL signal node", errors.get(0).message());
        assertEquals(FlowIssue.Category.STRATEGY, errors.get(0).category());

        List<FlowIssue> none = rules.checkSignals(LogicFlow.empty(), Map.of(), CATALOG);
        assertEquals(List.of(FlowIssue.Code.MISSING_BUY_SIGNAL, FlowIssue.Code.MISSING_SELL_SIGNAL), codes(none));
    }

    @Test
    public void testSignalTypeComesFromEffectiveParameters() {
        FlowBuilder f = FlowBuilder.create();
        f.node("a", "buy_signal");
        f.node("b", "buy_signal");
        f.param("b", "signal_type", "SELL");

        assertTrue(rules.checkSignals(f.build(), f.parameters(), CATALOG).isEmpty());
    }

    @Test
    public void testPositionAllocationLimit() {
        FlowBuilder f = buyAndSell();
        f.node("p1", "fixed_fraction");
        f.node("p2", "fixed_fraction");
        f.param("p1", "fraction", 0.6);
        f.param("p2", "fraction", 0.5);

        List<FlowIssue> errors = rules.checkPositions(f.build(), f.parameters(), CATALOG);
        assertEquals(List.of(FlowIssue.Code.POSITION_EXCEEDED), codes(errors));
        assertEquals("Total position allocation (110%) exceeds 100%", errors.get(0).message());

        FlowBuilder exact = buyAndSell();
        exact.node("p1", "fixed_fraction");
        exact.node("p2", "fixed_fraction");
        exact.param("p1", "fraction", 0.7);
        exact.param("p2", "fraction", 0.3);
        assertTrue(rules.checkPositions(exact.build(), exact.parameters(), CATALOG).isEmpty());
    }

    @Test
    public void testPositionWithoutValue() {
        FlowBuilder f = buyAndSell();
        f.node("size", "bare_position");

        List<FlowIssue> errors = rules.checkPositions(f.build(), f.parameters(), CATALOG);
        assertEquals(List.of(FlowIssue.Code.MISSING_POSITION_VALUE), codes(errors));
        assertEquals("size", errors.get(0).nodeId());
        assertEquals("Position node size must have 'fraction' set", errors.get(0).message());
    }

    @Test
    public void testStopLossWithoutValue() {
        FlowBuilder f = buyAndSell();
        f.node("stop", "percent_stop_loss");
        f.node("stop2", "percent_stop_loss");
        f.param("stop", "percent", null);

        List<FlowIssue> errors = rules.checkStopLoss(f.build(), f.parameters(), CATALOG);
        assertEquals(1, errors.size());
        assertEquals(FlowIssue.Code.MISSING_STOP_LOSS_VALUE, errors.get(0).code());
        assertEquals("stop", errors.get(0).nodeId());
        assertEquals("Stop loss node stop must have 'percent' set", errors.get(0).message());
    }

    @Test
    public void testCheckCollectsEveryRule() {
        FlowBuilder f = FlowBuilder.create();
        f.node("sell", "sell_signal");
        f.node("size", "bare_position");
        f.node("stop", "percent_stop_loss");
        f.node("ghost", "no_such_template");
        f.param("stop", "percent", null);

        assertEquals(List.of(FlowIssue.Code.MISSING_BUY_SIGNAL, FlowIssue.Code.MISSING_POSITION_VALUE,
                FlowIssue.Code.MISSING_STOP_LOSS_VALUE), codes(rules.check(f.build(), f.parameters(), CATALOG)));
    }
}
