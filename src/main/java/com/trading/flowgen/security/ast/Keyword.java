package com.trading.flowgen.security.ast;

import java.util.List;

/** Keyword argument of a call or class header; {@code arg} is null for {@code **value}. */
public record Keyword(int line, String arg, Expr value) implements PyNode {

    @Override
    public List<PyNode> children() {
        return PyNode.childrenOf(value);
    }
}
