package com.trading.flowgen.security.ast;

/** One {@code name [as asName]} entry of an import statement. */
public record Alias(String name, String asName) {

    /** Name bound in the importing scope. */
    public String boundName() {
        if (asName != null)
            return asName;
        int dot = name.indexOf('.');
        return dot < 0 ? name : name.substring(0, dot);
    }
}
