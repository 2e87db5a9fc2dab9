package com.trading.flowgen.security.ast;

import java.util.ArrayList;
import java.util.List;

/** Parameter list of a function definition or lambda. */
public record Arguments(List<Param> params) {

    public enum Kind {
        POSITIONAL,
        VAR_POSITIONAL,
        KEYWORD_ONLY,
        VAR_KEYWORD
    }

    public record Param(String name, Kind kind, Expr annotation, Expr defaultValue) {
    }

    public Arguments {
        params = List.copyOf(params);
    }

    public static Arguments none() {
        return new Arguments(List.of());
    }

    /** Annotations and default values, which are evaluated expressions. */
    public List<Expr> expressions() {
        List<Expr> out = new ArrayList<>();
        for (Param p : params) {
            if (p.annotation() != null)
                out.add(p.annotation());
            if (p.defaultValue() != null)
                out.add(p.defaultValue());
        }
        return out;
    }
}
