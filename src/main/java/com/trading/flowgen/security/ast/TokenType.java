package com.trading.flowgen.security.ast;

public enum TokenType {
    NAME,
    NUMBER,
    STRING,
    OP,
    NEWLINE,
    INDENT,
    DEDENT,
    ENDMARKER
}
