package com.trading.flowgen.security.ast;

import com.trading.flowgen.security.SourceSyntaxException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Hand-written tokenizer for the Python subset emitted by the code generator.
 *
 * <p>
 * Produces NEWLINE, INDENT and DEDENT tokens the way the reference tokenizer
 * does: blank and comment-only lines are dropped, newlines inside brackets are
 * ignored and a backslash joins physical lines. Keywords are returned as NAME
 * tokens; the parser tells them apart.
 */
public final class PythonLexer {
    private static final String[] OPERATORS = {
            "**=", "//=", ">>=", "<<=", "...",
            "->", ":=", "**", "//", "<<", ">>", "<=", ">=", "==", "!=",
            "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "@=",
            "+", "-", "*", "/", "%", "@", "&", "|", "^", "~", "<", ">",
            "(", ")", "[", "]", "{", "}", ",", ":", ".", ";", "=" };

    private static final Set<String> STRING_PREFIXES = Set.of(
            "r", "u", "b", "f", "br", "rb", "fr", "rf");

    static final int MAX_BRACKET_DEPTH = 200;
    static final int MAX_INDENT_DEPTH = 100;

    private final String src;
    private final List<Token> tokens = new ArrayList<>();
    private final Deque<Integer> indents = new ArrayDeque<>();
    private final Deque<Token> brackets = new ArrayDeque<>();
    private int pos;
    private int line;
    private int lineStart;
    private boolean atLineStart = true;

    public PythonLexer(String src) {
        this(src, 1);
    }

    /** @param firstLine line number reported for the first line of {@code src} */
    public PythonLexer(String src, int firstLine) {
        this.src = src;
        this.line = firstLine;
        indents.push(0);
    }

    public List<Token> tokenize() {
        while (true) {
            if (atLineStart && brackets.isEmpty()) {
                if (readIndentation())
                    continue;
            }
            if (pos >= src.length())
                break;
            char c = src.charAt(pos);
            if (c == ' ' || c == '\t' || c == '\f') {
                pos++;
            } else if (c == '#') {
                skipComment();
            } else if (c == '\\') {
                joinLines();
            } else if (c == '\n' || c == '\r') {
                consumeNewline();
                if (brackets.isEmpty()) {
                    emit(TokenType.NEWLINE, "\n", line - 1, 0);
                    atLineStart = true;
                }
            } else if (isIdentStart(c)) {
                readNameOrString();
            } else if (isDigit(c) || (c == '.' && pos + 1 < src.length() && isDigit(src.charAt(pos + 1)))) {
                readNumber();
            } else if (c == '"' || c == '\'') {
                readString(pos, column());
            } else {
                readOperator();
            }
        }

        if (!brackets.isEmpty()) {
            Token open = brackets.peek();
            throw new SourceSyntaxException("'" + open.text() + "' was never closed", open.line(), open.column());
        }
        if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).type() != TokenType.NEWLINE
                && tokens.get(tokens.size() - 1).type() != TokenType.DEDENT)
            emit(TokenType.NEWLINE, "", line, column());
        while (indents.peek() > 0) {
            indents.pop();
            emit(TokenType.DEDENT, "", line, 0);
        }
        emit(TokenType.ENDMARKER, "", line, 0);
        return tokens;
    }

    /**
     * Measures leading whitespace of a logical line and emits INDENT/DEDENT.
     *
     * @return true if the line was blank or comment-only and has been consumed
     */
    private boolean readIndentation() {
        int width = 0;
        while (pos < src.length()) {
            char c = src.charAt(pos);
            if (c == ' ')
                width++;
            else if (c == '\t')
                width = (width / 8 + 1) * 8;
            else if (c == '\f')
                width = 0;
            else
                break;
            pos++;
        }
        if (pos >= src.length()) {
            atLineStart = false;
            return false;
        }
        char c = src.charAt(pos);
        if (c == '#') {
            skipComment();
            if (pos < src.length())
                consumeNewline();
            return true;
        }
        if (c == '\n' || c == '\r') {
            consumeNewline();
            return true;
        }

        atLineStart = false;
        int current = indents.peek();
        if (width > current) {
            if (indents.size() > MAX_INDENT_DEPTH)
                throw new SourceSyntaxException("too many levels of indentation", line, width + 1);
            indents.push(width);
            emit(TokenType.INDENT, "", line, 1);
        } else if (width < current) {
            while (indents.peek() > width) {
                indents.pop();
                emit(TokenType.DEDENT, "", line, 1);
            }
            if (indents.peek() != width)
                throw new SourceSyntaxException("unindent does not match any outer indentation level", line, width + 1);
        }
        return false;
    }

    private void readNameOrString() {
        int start = pos;
        int col = column();
        while (pos < src.length() && isIdentPart(src.charAt(pos)))
            pos++;
        String word = src.substring(start, pos);
        if (pos < src.length() && (src.charAt(pos) == '"' || src.charAt(pos) == '\'')
                && STRING_PREFIXES.contains(word.toLowerCase())) {
            readString(start, col);
            return;
        }
        emit(TokenType.NAME, word, line, col);
    }

    /** Reads a string literal whose prefix (possibly empty) begins at {@code start}. */
    private void readString(int start, int col) {
        int startLine = line;
        char quote = src.charAt(pos);
        boolean triple = src.startsWith(String.valueOf(quote).repeat(3), pos);
        pos += triple ? 3 : 1;
        while (true) {
            if (pos >= src.length()) {
                String kind = triple ? "unterminated triple-quoted string literal" : "unterminated string literal";
                throw new SourceSyntaxException(kind, startLine, col);
            }
            char c = src.charAt(pos);
            if (c == '\\') {
                pos++;
                if (pos < src.length()) {
                    char n = src.charAt(pos);
                    if (n == '\r' || n == '\n') {
                        consumeNewline();
                        continue;
                    }
                    pos++;
                }
                continue;
            }
            if (c == '\n' || c == '\r') {
                if (!triple)
                    throw new SourceSyntaxException("unterminated string literal", startLine, col);
                consumeNewline();
                continue;
            }
            if (c == quote) {
                if (!triple) {
                    pos++;
                    break;
                }
                if (src.startsWith(String.valueOf(quote).repeat(3), pos)) {
                    pos += 3;
                    break;
                }
            }
            pos++;
        }
        emit(TokenType.STRING, src.substring(start, pos), startLine, col);
    }

    private void readNumber() {
        int start = pos;
        int col = column();
        if (src.charAt(pos) == '0' && pos + 1 < src.length() && "xXoObB".indexOf(src.charAt(pos + 1)) >= 0) {
            char radix = Character.toLowerCase(src.charAt(pos + 1));
            pos += 2;
            int digits = 0;
            while (pos < src.length() && (isRadixDigit(src.charAt(pos), radix) || src.charAt(pos) == '_')) {
                pos++;
                digits++;
            }
            if (digits == 0)
                throw new SourceSyntaxException("invalid " + radixName(radix) + " literal", line, col);
        } else {
            readDigits();
            if (pos < src.length() && src.charAt(pos) == '.') {
                pos++;
                readDigits();
            }
            if (pos < src.length() && (src.charAt(pos) == 'e' || src.charAt(pos) == 'E')) {
                pos++;
                if (pos < src.length() && (src.charAt(pos) == '+' || src.charAt(pos) == '-'))
                    pos++;
                if (pos >= src.length() || !isDigit(src.charAt(pos)))
                    throw new SourceSyntaxException("invalid decimal literal", line, col);
                readDigits();
            }
            if (pos < src.length() && (src.charAt(pos) == 'j' || src.charAt(pos) == 'J'))
                pos++;
        }
        if (pos < src.length() && isIdentStart(src.charAt(pos)))
            throw new SourceSyntaxException("invalid decimal literal", line, col);
        emit(TokenType.NUMBER, src.substring(start, pos), line, col);
    }

    private void readDigits() {
        while (pos < src.length() && (isDigit(src.charAt(pos)) || src.charAt(pos) == '_'))
            pos++;
    }

    private void readOperator() {
        int col = column();
        for (String op : OPERATORS) {
            if (src.startsWith(op, pos)) {
                pos += op.length();
                Token t = emit(TokenType.OP, op, line, col);
                trackBracket(t);
                return;
            }
        }
        char c = src.charAt(pos);
        if (c == '!')
            throw new SourceSyntaxException("invalid syntax", line, col);
        throw new SourceSyntaxException("invalid character '" + c + "' (U+"
                + String.format("%04X", (int) c) + ")", line, col);
    }

    private void trackBracket(Token t) {
        switch (t.text()) {
            case "(", "[", "{" -> {
                if (brackets.size() >= MAX_BRACKET_DEPTH)
                    throw new SourceSyntaxException("too many nested parentheses", t.line(), t.column());
                brackets.push(t);
            }
            case ")", "]", "}" -> {
                if (brackets.isEmpty())
                    throw new SourceSyntaxException("unmatched '" + t.text() + "'", t.line(), t.column());
                String open = brackets.pop().text();
                if (!matches(open, t.text()))
                    throw new SourceSyntaxException("closing parenthesis '" + t.text()
                            + "' does not match opening parenthesis '" + open + "'", t.line(), t.column());
            }
            default -> {
            }
        }
    }

    private static boolean matches(String open, String close) {
        return (open.equals("(") && close.equals(")"))
                || (open.equals("[") && close.equals("]"))
                || (open.equals("{") && close.equals("}"));
    }

    private void joinLines() {
        int col = column();
        pos++;
        if (pos < src.length() && (src.charAt(pos) == '\n' || src.charAt(pos) == '\r')) {
            consumeNewline();
            return;
        }
        throw new SourceSyntaxException("unexpected character after line continuation character", line, col);
    }

    private void skipComment() {
        while (pos < src.length() && src.charAt(pos) != '\n' && src.charAt(pos) != '\r')
            pos++;
    }

    private void consumeNewline() {
        if (src.charAt(pos) == '\r' && pos + 1 < src.length() && src.charAt(pos + 1) == '\n')
            pos++;
        pos++;
        line++;
        lineStart = pos;
    }

    private Token emit(TokenType type, String text, int l, int col) {
        Token t = new Token(type, text, l, col);
        tokens.add(t);
        return t;
    }

    private int column() {
        return pos - lineStart + 1;
    }

    private static boolean isIdentStart(char c) {
        return c == '_' || Character.isLetter(c);
    }

    private static boolean isIdentPart(char c) {
        return c == '_' || Character.isLetterOrDigit(c);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isRadixDigit(char c, char radix) {
        return switch (radix) {
            case 'x' -> isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
            case 'o' -> c >= '0' && c <= '7';
            default -> c == '0' || c == '1';
        };
    }

    private static String radixName(char radix) {
        return switch (radix) {
            case 'x' -> "hexadecimal";
            case 'o' -> "octal";
            default -> "binary";
        };
    }
}
