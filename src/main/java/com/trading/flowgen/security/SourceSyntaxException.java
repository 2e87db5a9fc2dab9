package com.trading.flowgen.security;

/**
 * Raised by a {@link SourceParser} when text is not well-formed.
 * Line and column are 1-based; 0 means unknown.
 */
public class SourceSyntaxException extends RuntimeException {
    private final int line;
    private final int column;

    public SourceSyntaxException(String message, int line, int column) {
        super(message);
        this.line = line;
        this.column = column;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    @Override
    public String toString() {
        return "SourceSyntaxException{" + getMessage() + " at " + line + ":" + column + "}";
    }
}
