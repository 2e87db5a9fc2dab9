package com.trading.flowgen.graph;

import java.util.List;

/**
 * An error or warning reported by {@link LogicFlowValidator} or {@link StrategyRules}.
 *
 * @param nodeId node concerned, or null
 * @param edgeId edge concerned, or null
 * @param cycle  ordered node ids of a detected cycle; empty otherwise
 */
public record FlowIssue(Code code, Severity severity, String message, String nodeId, String edgeId,
        List<String> cycle) {

    public enum Severity {
        ERROR,
        WARNING
    }

    public enum Category {
        STRUCTURAL,
        REFERENCE,
        TYPE,
        STRATEGY
    }

    public enum Code {
        MALFORMED_FLOW(Category.STRUCTURAL),
        DUPLICATE_NODE(Category.STRUCTURAL),
        FLOW_TOO_LARGE(Category.STRUCTURAL),
        DANGLING_EDGE(Category.STRUCTURAL),
        CIRCULAR_DEPENDENCY(Category.STRUCTURAL),
        TEMPLATE_NOT_FOUND(Category.REFERENCE),
        MISSING_TEMPLATE_ID(Category.REFERENCE),
        TYPE_MISMATCH(Category.TYPE),
        ISOLATED_NODE(Category.STRUCTURAL),
        MISSING_BUY_SIGNAL(Category.STRATEGY),
        MISSING_SELL_SIGNAL(Category.STRATEGY),
        MISSING_POSITION_VALUE(Category.STRATEGY),
        POSITION_EXCEEDED(Category.STRATEGY),
        MISSING_STOP_LOSS_VALUE(Category.STRATEGY);

        private final Category category;

        Code(Category category) {
            this.category = category;
        }

        public Category category() {
            return category;
        }
    }

    public FlowIssue {
        cycle = cycle == null ? List.of() : List.copyOf(cycle);
    }

    public static FlowIssue error(Code code, String message) {
        return new FlowIssue(code, Severity.ERROR, message, null, null, List.of());
    }

    public static FlowIssue nodeError(Code code, String nodeId, String message) {
        return new FlowIssue(code, Severity.ERROR, message, nodeId, null, List.of());
    }

    public static FlowIssue edgeError(Code code, String edgeId, String message) {
        return new FlowIssue(code, Severity.ERROR, message, null, edgeId, List.of());
    }

    public static FlowIssue cycle(List<String> cycle) {
        return new FlowIssue(Code.CIRCULAR_DEPENDENCY, Severity.ERROR,
                "Circular dependency detected: " + String.join(" -> ", cycle), null, null, cycle);
    }

    public static FlowIssue nodeWarning(Code code, String nodeId, String message) {
        return new FlowIssue(code, Severity.WARNING, message, nodeId, null, List.of());
    }

    public Category category() {
        return code.category();
    }
}
