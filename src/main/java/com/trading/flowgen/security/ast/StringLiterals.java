package com.trading.flowgen.security.ast;

import com.trading.flowgen.security.SourceSyntaxException;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;

/**
 * Decoding of string literal tokens, including splitting f-strings into
 * literal chunks and replacement-field expressions.
 */
final class StringLiterals {
    private StringLiterals() {
        // Utility class
    }

    /** Lower-cased prefix letters of a string token, e.g. {@code "rb"}. */
    static String prefix(String token) {
        int i = 0;
        while (i < token.length() && token.charAt(i) != '"' && token.charAt(i) != '\'')
            i++;
        return token.substring(0, i).toLowerCase();
    }

    /** Raw text between the quotes. */
    static String body(String token) {
        int start = prefix(token).length();
        char quote = token.charAt(start);
        int q = token.startsWith(String.valueOf(quote).repeat(3), start) && token.length() - start >= 6 ? 3 : 1;
        return token.substring(start + q, token.length() - q);
    }

    /** Decoded value of a non-formatted literal. */
    static String value(Token token) {
        return decode(body(token.text()), prefix(token.text()).contains("r"), token);
    }

    private static String decode(String text, boolean raw, Token token) {
        if (raw)
            return text;
        try {
            return unescape(text);
        } catch (IllegalArgumentException e) {
            throw new SourceSyntaxException("(unicode error) " + e.getMessage(), token.line(), token.column());
        }
    }

    /**
     * Splits an f-string token into constants and parsed expressions.
     *
     * @param fieldParser parses replacement-field source starting at the given line
     */
    static List<Expr> formatted(Token token, BiFunction<String, Integer, Expr> fieldParser) {
        String body = body(token.text());
        boolean raw = prefix(token.text()).contains("r");
        List<Expr> out = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c == '{') {
                if (i + 1 < body.length() && body.charAt(i + 1) == '{') {
                    literal.append('{');
                    i += 2;
                    continue;
                }
                flush(literal, raw, token, out);
                i = field(body, i, token, fieldParser, out);
            } else if (c == '}') {
                if (i + 1 < body.length() && body.charAt(i + 1) == '}') {
                    literal.append('}');
                    i += 2;
                    continue;
                }
                throw new SourceSyntaxException("f-string: single '}' is not allowed", token.line(), token.column());
            } else {
                literal.append(c);
                i++;
            }
        }
        flush(literal, raw, token, out);
        return out;
    }

    /**
     * Parses the replacement field opening at {@code open}.
     *
     * @return index just past the closing brace
     */
    private static int field(String body, int open, Token token, BiFunction<String, Integer, Expr> fieldParser,
            List<Expr> out) {
        int line = token.line() + count(body, open, '\n');
        int i = open + 1;
        int depth = 0;
        char inString = 0;
        int exprEnd = -1;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (inString != 0) {
                if (c == inString)
                    inString = 0;
            } else if (c == '\'' || c == '"') {
                inString = c;
            } else if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if ((c == ')' || c == ']' || c == '}') && depth > 0) {
                depth--;
            } else if (depth == 0 && (c == '}' || c == ':'
                    || (c == '!' && (i + 1 >= body.length() || body.charAt(i + 1) != '=')))) {
                exprEnd = i;
                break;
            }
            i++;
        }
        if (exprEnd < 0)
            throw new SourceSyntaxException("f-string: expecting '}'", token.line(), token.column());

        String expr = body.substring(open + 1, exprEnd);
        String trimmed = expr.strip();
        if (trimmed.endsWith("=") && !trimmed.endsWith("==") && !trimmed.endsWith("!=")
                && !trimmed.endsWith("<=") && !trimmed.endsWith(">="))
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        if (trimmed.isBlank())
            throw new SourceSyntaxException("f-string: empty expression not allowed", token.line(), token.column());
        out.add(parseField(trimmed, line, token, fieldParser));

        i = exprEnd;
        if (body.charAt(i) == '!') {
            i++;
            while (i < body.length() && body.charAt(i) != ':' && body.charAt(i) != '}')
                i++;
        }
        if (i < body.length() && body.charAt(i) == ':') {
            i++;
            while (i < body.length() && body.charAt(i) != '}') {
                if (body.charAt(i) == '{')
                    i = field(body, i, token, fieldParser, out) - 1;
                i++;
            }
        }
        if (i >= body.length())
            throw new SourceSyntaxException("f-string: expecting '}'", token.line(), token.column());
        return i + 1;
    }

    private static Expr parseField(String source, int line, Token token,
            BiFunction<String, Integer, Expr> fieldParser) {
        try {
            return fieldParser.apply(source, line);
        } catch (SourceSyntaxException e) {
            throw new SourceSyntaxException("f-string: " + e.getMessage(), token.line(), token.column());
        }
    }

    private static void flush(StringBuilder literal, boolean raw, Token token, List<Expr> out) {
        if (literal.length() == 0)
            return;
        String text = decode(literal.toString(), raw, token);
        out.add(new Expr.Constant(token.line(), Expr.ConstantKind.STRING, text));
        literal.setLength(0);
    }

    private static int count(String s, int end, char c) {
        int n = 0;
        for (int i = 0; i < end; i++)
            if (s.charAt(i) == c)
                n++;
        return n;
    }

    /** @throws IllegalArgumentException on a malformed escape */
    static String unescape(String s) {
        if (s.indexOf('\\') < 0)
            return s;
        StringBuilder sb = new StringBuilder(s.length());
        int i = 0;
        while (i < s.length()) {
            char c = s.charAt(i++);
            if (c != '\\' || i >= s.length()) {
                sb.append(c);
                continue;
            }
            char e = s.charAt(i++);
            switch (e) {
                case '\n' -> {
                }
                case '\r' -> {
                    if (i < s.length() && s.charAt(i) == '\n')
                        i++;
                }
                case '\\', '\'', '"' -> sb.append(e);
                case 'n' -> sb.append('\n');
                case 't' -> sb.append('\t');
                case 'r' -> sb.append('\r');
                case 'a' -> sb.append('\u0007');
                case 'b' -> sb.append('\b');
                case 'f' -> sb.append('\f');
                case 'v' -> sb.append('\u000B');
                case 'x' -> i = hex(s, i, 2, sb);
                case 'u' -> i = hex(s, i, 4, sb);
                case 'U' -> i = hex(s, i, 8, sb);
                default -> {
                    if (e >= '0' && e <= '7') {
                        int start = i - 1;
                        int end = start;
                        while (end < s.length() && end < start + 3 && s.charAt(end) >= '0' && s.charAt(end) <= '7')
                            end++;
                        sb.append((char) Integer.parseInt(s.substring(start, end), 8));
                        i = end;
                    } else {
                        sb.append('\\').append(e);
                    }
                }
            }
        }
        return sb.toString();
    }

    private static int hex(String s, int from, int digits, StringBuilder sb) {
        int end = from + digits;
        if (end > s.length())
            throw new IllegalArgumentException("truncated escape at position " + (from - 2));
        try {
            sb.appendCodePoint(Integer.parseInt(s.substring(from, end), 16));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("malformed escape at position " + (from - 2), e);
        }
        return end;
    }
}
