package com.trading.flowgen.security;

/** A parse failure location. Line and column are 1-based; 0 when unknown. */
public record SyntaxError(int line, int column, String message) {

    static SyntaxError of(SourceSyntaxException e) {
        return new SyntaxError(e.line(), e.column(), e.getMessage());
    }

    @Override
    public String toString() {
        return "line " + line + ", column " + column + ": " + message;
    }
}
