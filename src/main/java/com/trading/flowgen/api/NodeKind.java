package com.trading.flowgen.api;

/**
 * Category of a node template. Drives how a node's fragment is rendered and
 * bound into the generated strategy module.
 */
public enum NodeKind {
    INDICATOR,
    CONDITION,
    SIGNAL,
    POSITION,
    STOP_LOSS,
    STOP_PROFIT,
    RISK_MANAGEMENT,
    CUSTOM;

    public static NodeKind fromString(String text) {
        if (text != null) {
            for (NodeKind k : NodeKind.values()) {
                if (k.name().equalsIgnoreCase(text.trim())) {
                    return k;
                }
            }
        }
        throw new IllegalArgumentException("Unknown NodeKind: " + text);
    }
}
