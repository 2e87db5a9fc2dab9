package com.trading.flowgen.param;

/**
 * One problem found in a node's parameters.
 *
 * @param field the offending field name
 */
public record ParameterError(String field, Code code, String message) {

    public enum Code {
        MISSING_REQUIRED,
        TYPE_MISMATCH,
        BELOW_MINIMUM,
        ABOVE_MAXIMUM,
        NOT_IN_ENUM
    }
}
