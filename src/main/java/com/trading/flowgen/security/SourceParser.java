package com.trading.flowgen.security;

import com.trading.flowgen.security.ast.PyModule;

/**
 * Turns generated source text into an abstract syntax tree.
 * The security checks only depend on this interface and the tree types.
 */
@FunctionalInterface
public interface SourceParser {

    /**
     * @throws SourceSyntaxException if the text is not well-formed
     */
    PyModule parse(String source);
}
