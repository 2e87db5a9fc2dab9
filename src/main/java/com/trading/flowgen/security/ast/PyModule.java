package com.trading.flowgen.security.ast;

import java.util.List;

/** Root of a parsed source file. */
public record PyModule(List<Stmt> body) implements PyNode {

    public PyModule {
        body = List.copyOf(body);
    }

    @Override
    public int line() {
        return 1;
    }

    @Override
    public List<PyNode> children() {
        return PyNode.childrenOf(body);
    }
}
