package com.trading.flowgen.graph;

import com.trading.flowgen.api.NodeKind;
import com.trading.flowgen.api.TemplateLookup;
import com.trading.flowgen.template.NodeTemplate;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.extern.log4j.Log4j2;

/**
 * Trading rules a complete strategy must satisfy, checked over the resolved
 * templates and the effective parameters (template defaults overlaid by
 * explicit values) of each node.
 *
 * <ul>
 * <li>Signals: at least one BUY and one SELL signal node.</li>
 * <li>Positions: every position node has a fraction, and the fractions add
 * up to at most 100% of capital.</li>
 * <li>Stop loss: every stop-loss node has a percent.</li>
 * </ul>
 * Nodes whose template does not resolve are skipped; the flow validator
 * already reports them.
 */
@Log4j2
public final class StrategyRules {
    public static final String SIGNAL_TYPE = "signal_type";
    public static final String POSITION_FRACTION = "fraction";
    public static final String STOP_LOSS_PERCENT = "percent";

    private static final BigDecimal FULL_ALLOCATION = BigDecimal.ONE;

    /** All three checks; errors in signal, position, stop-loss order. */
    public List<FlowIssue> check(LogicFlow flow, Map<String, ? extends Map<String, ?>> parameters,
            TemplateLookup lookup) {
        List<Resolved> nodes = resolve(flow, parameters, lookup);
        List<FlowIssue> errors = new ArrayList<>();
        errors.addAll(checkSignals(nodes));
        errors.addAll(checkPositions(nodes));
        errors.addAll(checkStopLoss(nodes));
        if (!errors.isEmpty())
            log.info("Strategy rules: {} error(s)", errors.size());
        return errors;
    }

    public List<FlowIssue> checkSignals(LogicFlow flow, Map<String, ? extends Map<String, ?>> parameters,
            TemplateLookup lookup) {
        return checkSignals(resolve(flow, parameters, lookup));
    }

    public List<FlowIssue> checkPositions(LogicFlow flow, Map<String, ? extends Map<String, ?>> parameters,
            TemplateLookup lookup) {
        return checkPositions(resolve(flow, parameters, lookup));
    }

    public List<FlowIssue> checkStopLoss(LogicFlow flow, Map<String, ? extends Map<String, ?>> parameters,
            TemplateLookup lookup) {
        return checkStopLoss(resolve(flow, parameters, lookup));
    }

    private static List<FlowIssue> checkSignals(List<Resolved> nodes) {
        boolean buy = false;
        boolean sell = false;
        for (Resolved n : nodes) {
            if (n.kind() != NodeKind.SIGNAL)
                continue;
            Object type = n.parameters().get(SIGNAL_TYPE);
            if (type instanceof String s) {
                buy |= s.equalsIgnoreCase("BUY");
                sell |= s.equalsIgnoreCase("SELL");
            }
        }
        List<FlowIssue> errors = new ArrayList<>();
        if (!buy)
            errors.add(FlowIssue.error(FlowIssue.Code.MISSING_BUY_SIGNAL,
                    "Strategy must contain at least one BUY signal node"));
        if (!sell)
            errors.add(FlowIssue.error(FlowIssue.Code.MISSING_SELL_SIGNAL,
                    "Strategy must contain at least one SELL signal node"));
        return errors;
    }

    private static List<FlowIssue> checkPositions(List<Resolved> nodes) {
        List<FlowIssue> errors = new ArrayList<>();
        BigDecimal total = BigDecimal.ZERO;
        for (Resolved n : nodes) {
            if (n.kind() != NodeKind.POSITION)
                continue;
            Object value = n.parameters().get(POSITION_FRACTION);
            if (!(value instanceof Number) || value instanceof Boolean) {
                errors.add(FlowIssue.nodeError(FlowIssue.Code.MISSING_POSITION_VALUE, n.nodeId(),
                        "Position node " + n.nodeId() + " must have '" + POSITION_FRACTION + "' set"));
                continue;
            }
            total = total.add(new BigDecimal(value.toString()));
        }
        if (total.compareTo(FULL_ALLOCATION) > 0) {
            String percent = total.movePointRight(2).stripTrailingZeros().toPlainString();
            errors.add(FlowIssue.error(FlowIssue.Code.POSITION_EXCEEDED,
                    "Total position allocation (" + percent + "%) exceeds 100%"));
        }
        return errors;
    }

    private static List<FlowIssue> checkStopLoss(List<Resolved> nodes) {
        List<FlowIssue> errors = new ArrayList<>();
        for (Resolved n : nodes) {
            if (n.kind() == NodeKind.STOP_LOSS && n.parameters().get(STOP_LOSS_PERCENT) == null)
                errors.add(FlowIssue.nodeError(FlowIssue.Code.MISSING_STOP_LOSS_VALUE, n.nodeId(),
                        "Stop loss node " + n.nodeId() + " must have '" + STOP_LOSS_PERCENT + "' set"));
        }
        return errors;
    }

    private static List<Resolved> resolve(LogicFlow flow, Map<String, ? extends Map<String, ?>> parameters,
            TemplateLookup lookup) {
        Map<String, ? extends Map<String, ?>> byNode = parameters != null ? parameters : Collections.emptyMap();
        List<Resolved> out = new ArrayList<>();
        for (GraphNode node : flow.nodes()) {
            Optional<NodeTemplate> template = lookup.getTemplate(node.templateId());
            if (template.isEmpty())
                continue;
            Map<String, Object> effective = new LinkedHashMap<>(template.get().defaultParameters());
            Map<String, ?> explicit = byNode.get(node.nodeId());
            if (explicit != null)
                effective.putAll(explicit);
            out.add(new Resolved(node.nodeId(), template.get().getKind(), effective));
        }
        return out;
    }

    private record Resolved(String nodeId, NodeKind kind, Map<String, Object> parameters) {
    }
}
