package com.trading.flowgen.security;

/**
 * Informational ranking of a violation. Any violation makes code unusable;
 * severity only orders them for display.
 */
public enum Severity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW
}
