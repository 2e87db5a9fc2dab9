package com.trading.flowgen.codegen;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Renders Java values as Python source literals. The output is always a
 * single literal expression, so rendered user input cannot add statements.
 */
public final class PythonLiterals {
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private static final Set<String> RESERVED = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
            "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
            "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise", "return",
            "try", "while", "with", "yield");

    private PythonLiterals() {
        // Utility class
    }

    /**
     * @throws IllegalArgumentException for values with no literal form
     */
    public static String literal(Object value) {
        if (value == null)
            return "None";
        if (value instanceof Boolean b)
            return b ? "True" : "False";
        if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger)
            return value.toString();
        if (value instanceof BigDecimal d)
            return d.toPlainString();
        if (value instanceof Double || value instanceof Float)
            return floatLiteral(((Number) value).doubleValue());
        if (value instanceof CharSequence s)
            return string(s.toString());
        if (value instanceof Map<?, ?> m)
            return dict(m);
        if (value instanceof Collection<?> c)
            return list(c);
        throw new IllegalArgumentException("No literal form for " + value.getClass().getSimpleName());
    }

    public static String string(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2).append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20 || c == 0x7f || c == 0x2028 || c == 0x2029)
                        sb.append(String.format("\\u%04x", (int) c));
                    else
                        sb.append(c);
                }
            }
        }
        return sb.append('"').toString();
    }

    /** A bare identifier; rejects anything that is not a plain non-keyword name. */
    public static String identifier(Object value) {
        if (!(value instanceof String s) || !isIdentifier(s))
            throw new IllegalArgumentException("Not a valid identifier: " + value);
        return s;
    }

    public static boolean isIdentifier(String s) {
        return s != null && IDENTIFIER.matcher(s).matches() && !RESERVED.contains(s);
    }

    /** Text safe to place after {@code #}: a single line. */
    public static String comment(String s) {
        return s == null ? "" : s.replaceAll("[\\r\\n\\u2028\\u2029\\f\\u000b]+", " ").strip();
    }

    private static String floatLiteral(double d) {
        if (Double.isNaN(d))
            return "float(\"nan\")";
        if (Double.isInfinite(d))
            return d > 0 ? "float(\"inf\")" : "-float(\"inf\")";
        return Double.toString(d);
    }

    private static String list(Collection<?> c) {
        StringBuilder sb = new StringBuilder("[");
        Iterator<?> it = c.iterator();
        while (it.hasNext()) {
            sb.append(literal(it.next()));
            if (it.hasNext())
                sb.append(", ");
        }
        return sb.append(']').toString();
    }

    private static String dict(Map<?, ?> m) {
        StringBuilder sb = new StringBuilder("{");
        Iterator<? extends Map.Entry<?, ?>> it = m.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<?, ?> e = it.next();
            sb.append(literal(e.getKey())).append(": ").append(literal(e.getValue()));
            if (it.hasNext())
                sb.append(", ");
        }
        return sb.append('}').toString();
    }
}
