package com.trading.flowgen.security.ast;

/**
 * Lexical token. {@code text} is the exact source slice, including string
 * prefixes and quotes. Line and column are 1-based.
 */
public record Token(TokenType type, String text, int line, int column) {

    public boolean is(TokenType t, String s) {
        return type == t && text.equals(s);
    }

    public boolean isOp(String s) {
        return type == TokenType.OP && text.equals(s);
    }

    public boolean isKeyword(String s) {
        return type == TokenType.NAME && text.equals(s);
    }

    @Override
    public String toString() {
        return type + "(" + text.replace("\n", "\\n") + ")@" + line + ":" + column;
    }
}
