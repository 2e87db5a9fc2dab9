package com.trading.flowgen.dsl;

import com.trading.flowgen.graph.GraphEdge;
import com.trading.flowgen.graph.GraphNode;
import com.trading.flowgen.graph.LogicFlow;
import org.junit.Test;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class FlowBuilderTest {

    @Test
    public void testBuildCrossover() {
        FlowBuilder f = FlowBuilder.create();
        f.node("fast", "sma").param("period", 10);
        f.node("slow", "sma").param("period", 30);
        f.node("cross", "crossover").param("direction", "below");
        f.connect("fast", "cross", "fast").connect("slow", "cross", "slow");
        LogicFlow flow = f.build();

        assertEquals(List.of("fast", "slow", "cross"), flow.nodeIds());
        assertEquals(List.of(
                new GraphEdge("e1", "fast", "cross", null, "fast"),
                new GraphEdge("e2", "slow", "cross", null, "slow")), flow.edges());
        assertEquals(Map.of("period", 10), f.parameters().get("fast"));
        assertEquals(Map.of("direction", "below"), f.parameters().get("cross"));
    }

    @Test
    public void testNodeSpecChaining() {
        FlowBuilder f = FlowBuilder.create();
        FlowBuilder.NodeSpec spec = f.node("cond", "threshold", "boolean", "series")
                .param("operator", "<")
                .param("threshold", 30);
        assertEquals("cond", spec.id());
        spec.and().node(GraphNode.of("sig", "buy_signal")).and().edge("cond", "sig");

        LogicFlow flow = f.build();
        GraphNode cond = flow.node("cond").orElseThrow();
        assertEquals("boolean", cond.outputType());
        assertEquals("series", cond.inputType());
        assertEquals(2, f.parameters().get("cond").size());
        assertFalse(f.parameters().containsKey("sig"));
    }

    @Test
    public void testParametersAreCopied() {
        FlowBuilder f = FlowBuilder.create();
        f.node("a", "sma").param("period", 5);
        f.parameters().get("a").put("period", 99);
        assertEquals(5, f.parameters().get("a").get("period"));
    }

    @Test
    public void testForwardReferencesAllowed() {
        FlowBuilder f = FlowBuilder.create();
        f.edge("a", "b");
        f.node("a", "sma");
        LogicFlow flow = f.build();
        assertEquals("b", flow.edges().get(0).targetNodeId());
        assertFalse(flow.node("b").isPresent());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicateNode() {
        FlowBuilder f = FlowBuilder.create();
        f.node("a", "sma");
        f.node("a", "ema");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBlankNodeId() {
        FlowBuilder.create().node(" ", "sma");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testParamOnUnknownNode() {
        FlowBuilder.create().param("missing", "period", 1);
    }

    @Test
    public void testNoChangesAfterBuild() {
        FlowBuilder f = FlowBuilder.create();
        f.node("a", "sma");
        f.build();
        try {
            f.node("b", "sma");
            fail();
        } catch (IllegalStateException e) {
            assertEquals("Flow already built", e.getMessage());
        }
        try {
            f.build();
            fail();
        } catch (IllegalStateException expected) {
            // ok
        }
    }
}
