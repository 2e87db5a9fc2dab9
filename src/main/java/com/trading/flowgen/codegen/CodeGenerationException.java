package com.trading.flowgen.codegen;

/**
 * Generation could not produce a module. Indicates a template or generator
 * bug, not bad user input.
 */
public class CodeGenerationException extends RuntimeException {

    public CodeGenerationException(String message) {
        super(message);
    }

    public CodeGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
