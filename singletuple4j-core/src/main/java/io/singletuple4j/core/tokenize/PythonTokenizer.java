/*
 * Copyright (c) 2025 SingleTuple4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.singletuple4j.core.tokenize;

import io.singletuple4j.core.syntax.Position;
import io.singletuple4j.core.syntax.Token;
import io.singletuple4j.core.syntax.TokenKind;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Line-oriented tokenizer for Python 3 source, producing the same token classes as CPython's
 * {@code tokenize} module (comments, NL and INDENT/DEDENT included).
 *
 * <p>F-strings are returned as a single {@link TokenKind#STRING} token. Keywords are reported as
 * {@link TokenKind#KEYWORD}; soft keywords ({@code match}, {@code case}, {@code type}) stay names.
 *
 * <p>Not thread-safe; use the static entry points, which create a fresh instance per call.
 */
public final class PythonTokenizer {

    public static final Set<String> KEYWORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class", "continue", "def",
            "del", "elif", "else", "except", "finally", "for", "from", "global", "if", "import", "in", "is",
            "lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try", "while", "with", "yield");

    // longest first
    private static final List<String> OPERATORS = List.of(
            "**=", "//=", ">>=", "<<=", "...",
            "**", "//", "<<", ">>", "<=", ">=", "==", "!=", "->", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=",
            "@=", ":=",
            "+", "-", "*", "/", "%", "@", "&", "|", "^", "~", "<", ">", "(", ")", "[", "]", "{", "}", ",", ":", ".",
            ";", "=");

    private static final Set<String> STRING_PREFIXES = Set.of("r", "u", "f", "b", "br", "rb", "fr", "rf");

    private final List<String> lines;
    private final List<Token> tokens = new ArrayList<>();
    private final Deque<Integer> indents = new ArrayDeque<>();
    private final Deque<Token> brackets = new ArrayDeque<>();
    private boolean continuation;

    // string literal spanning several lines
    private Position stringStart;
    private String stringDelimiter;
    private boolean stringFormatted;
    private StringBuilder stringText;

    private PythonTokenizer(List<String> lines) {
        this.lines = lines;
    }

    public static List<Token> tokenize(String source) throws TokenizeException {
        Objects.requireNonNull(source, "source");
        return tokenize(source.lines().toList());
    }

    /**
     * @param lines source lines, with or without their line terminators
     * @return the full token stream, ending with {@link TokenKind#END_MARKER}
     * @throws TokenizeException if the lines do not form a complete token stream
     */
    public static List<Token> tokenize(List<String> lines) throws TokenizeException {
        Objects.requireNonNull(lines, "lines");
        return new PythonTokenizer(lines).run();
    }

    private List<Token> run() throws TokenizeException {
        indents.push(0);
        int lnum = 0;
        for (String raw : lines) {
            lnum++;
            tokenizeLine(stripTerminator(raw), lnum);
        }
        if (stringStart != null) {
            throw new TokenizeException("EOF in multi-line string", stringStart);
        }
        Position eof = Position.of(lnum + 1, 0);
        if (!brackets.isEmpty() || continuation) {
            throw new TokenizeException("EOF in multi-line statement", eof);
        }
        while (indents.peek() > 0) {
            indents.pop();
            add(TokenKind.DEDENT, "", eof, eof);
        }
        add(TokenKind.END_MARKER, "", eof, eof);
        return List.copyOf(tokens);
    }

    private void tokenizeLine(String line, int lnum) throws TokenizeException {
        int pos = 0;
        int max = line.length();

        if (stringStart != null) {
            int end = findStringEnd(line, 0, stringDelimiter, stringFormatted);
            if (end < 0) {
                if (stringDelimiter.length() == 1 && !endsWithEscape(line)) {
                    throw new TokenizeException("unterminated string literal", stringStart);
                }
                stringText.append(line).append('\n');
                return;
            }
            stringText.append(line, 0, end);
            add(TokenKind.STRING, stringText.toString(), stringStart, Position.of(lnum, end));
            stringStart = null;
            stringDelimiter = null;
            stringFormatted = false;
            stringText = null;
            pos = end;
        } else if (brackets.isEmpty() && !continuation) {
            int column = 0;
            while (pos < max) {
                char c = line.charAt(pos);
                if (c == ' ') {
                    column++;
                } else if (c == '\t') {
                    column = (column / 8 + 1) * 8;
                } else if (c == '\f') {
                    column = 0;
                } else {
                    break;
                }
                pos++;
            }
            if (pos == max || line.charAt(pos) == '#') {
                // blank or comment-only lines never affect indentation
                if (pos < max) {
                    add(TokenKind.COMMENT, line.substring(pos), Position.of(lnum, pos), Position.of(lnum, max));
                }
                add(TokenKind.NL, "\n", Position.of(lnum, max), Position.of(lnum, max + 1));
                return;
            }
            if (column > indents.peek()) {
                indents.push(column);
                add(TokenKind.INDENT, line.substring(0, pos), Position.of(lnum, 0), Position.of(lnum, pos));
            }
            while (column < indents.peek()) {
                indents.pop();
                if (column > indents.peek()) {
                    throw new TokenizeException(
                            "unindent does not match any outer indentation level", Position.of(lnum, pos));
                }
                add(TokenKind.DEDENT, "", Position.of(lnum, pos), Position.of(lnum, pos));
            }
        } else {
            continuation = false;
        }

        while (pos < max) {
            char c = line.charAt(pos);
            if (c == ' ' || c == '\t' || c == '\f') {
                pos++;
                continue;
            }
            Position start = Position.of(lnum, pos);
            if (c == '#') {
                add(TokenKind.COMMENT, line.substring(pos), start, Position.of(lnum, max));
                pos = max;
            } else if (c == '\\') {
                if (pos != max - 1) {
                    throw new TokenizeException("unexpected character after line continuation character", start);
                }
                continuation = true;
                return;
            } else if (isIdentifierStart(line.codePointAt(pos))) {
                int end = pos + Character.charCount(line.codePointAt(pos));
                while (end < max && isIdentifierPart(line.codePointAt(end))) {
                    end += Character.charCount(line.codePointAt(end));
                }
                String word = line.substring(pos, end);
                if (end < max && isQuote(line.charAt(end)) && STRING_PREFIXES.contains(word.toLowerCase(Locale.ROOT))) {
                    pos = readString(line, lnum, pos, end);
                    if (pos < 0) return;
                } else {
                    add(KEYWORDS.contains(word) ? TokenKind.KEYWORD : TokenKind.NAME, word, start, Position.of(lnum, end));
                    pos = end;
                }
            } else if (isQuote(c)) {
                pos = readString(line, lnum, pos, pos);
                if (pos < 0) return;
            } else if (Character.isDigit(c) || (c == '.' && pos + 1 < max && Character.isDigit(line.charAt(pos + 1)))) {
                pos = readNumber(line, lnum, pos);
            } else {
                String op = matchOperator(line, pos);
                if (op == null) {
                    throw new TokenizeException("invalid character '" + c + "'", start);
                }
                int end = pos + op.length();
                Token token = add(TokenKind.OP, op, start, Position.of(lnum, end));
                trackBracket(token);
                pos = end;
            }
        }

        TokenKind kind = brackets.isEmpty() ? TokenKind.NEWLINE : TokenKind.NL;
        add(kind, "\n", Position.of(lnum, max), Position.of(lnum, max + 1));
    }

    /** Returns the position after the literal, or -1 when it continues on the next line. */
    private int readString(String line, int lnum, int tokenStart, int quotePos) throws TokenizeException {
        char q = line.charAt(quotePos);
        String triple = String.valueOf(q).repeat(3);
        String delimiter = line.startsWith(triple, quotePos) ? triple : String.valueOf(q);
        Position start = Position.of(lnum, tokenStart);
        boolean formatted = line.substring(tokenStart, quotePos).toLowerCase(Locale.ROOT).contains("f");

        int end = findStringEnd(line, quotePos + delimiter.length(), delimiter, formatted);
        if (end >= 0) {
            add(TokenKind.STRING, line.substring(tokenStart, end), start, Position.of(lnum, end));
            return end;
        }
        if (delimiter.length() == 1 && !endsWithEscape(line)) {
            throw new TokenizeException("unterminated string literal", start);
        }
        stringStart = start;
        stringDelimiter = delimiter;
        stringFormatted = formatted;
        stringText = new StringBuilder(line.substring(tokenStart)).append('\n');
        return -1;
    }

    /**
     * Returns the position after the closing delimiter, or -1 when the line ends first. Replacement
     * fields of f-strings may hold nested literals in any quote, as in {@code f"{d["k"]}"}; a
     * replacement field left open at the end of a line is not carried to the next one.
     */
    private static int findStringEnd(String line, int from, String delimiter, boolean formatted) {
        int depth = 0;
        int i = from;
        while (i < line.length()) {
            char ch = line.charAt(i);
            if (depth > 0) {
                if (ch == '{') {
                    depth++;
                } else if (ch == '}') {
                    depth--;
                } else if (isQuote(ch)) {
                    int end = findStringEnd(line, i + 1, String.valueOf(ch), false);
                    if (end < 0) return -1;
                    i = end;
                    continue;
                }
                i++;
                continue;
            }
            if (ch == '\\') {
                i += 2;
                continue;
            }
            if (formatted && ch == '{') {
                if (line.startsWith("{{", i)) {
                    // literal brace
                    i += 2;
                } else {
                    depth++;
                    i++;
                }
                continue;
            }
            if (line.startsWith(delimiter, i)) {
                return i + delimiter.length();
            }
            i++;
        }
        return -1;
    }

    private int readNumber(String line, int lnum, int pos) {
        int max = line.length();
        boolean hex = line.startsWith("0x", pos) || line.startsWith("0X", pos);
        int end = pos;
        while (end < max) {
            char ch = line.charAt(end);
            if (!Character.isLetterOrDigit(ch) && ch != '_' && ch != '.') break;
            end++;
            if (!hex && (ch == 'e' || ch == 'E') && end < max && (line.charAt(end) == '+' || line.charAt(end) == '-')) {
                end++;
            }
        }
        add(TokenKind.NUMBER, line.substring(pos, end), Position.of(lnum, pos), Position.of(lnum, end));
        return end;
    }

    private void trackBracket(Token token) throws TokenizeException {
        if (token.isOpeningBracket()) {
            brackets.push(token);
            return;
        }
        if (!token.isClosingBracket()) return;
        if (brackets.isEmpty()) {
            throw new TokenizeException("unmatched '" + token.text() + "'", token.start());
        }
        Token open = brackets.pop();
        if (!closes(open.text(), token.text())) {
            throw new TokenizeException(
                    "closing parenthesis '" + token.text() + "' does not match opening parenthesis '" + open.text()
                            + "'",
                    token.start());
        }
    }

    private static boolean closes(String open, String close) {
        return switch (open) {
            case "(" -> close.equals(")");
            case "[" -> close.equals("]");
            case "{" -> close.equals("}");
            default -> false;
        };
    }

    private static String matchOperator(String line, int pos) {
        for (String op : OPERATORS) {
            if (line.startsWith(op, pos)) return op;
        }
        return null;
    }

    private Token add(TokenKind kind, String text, Position start, Position end) {
        Token t = new Token(kind, text, start, end);
        tokens.add(t);
        return t;
    }

    private static boolean isQuote(char c) {
        return c == '"' || c == '\'';
    }

    private static boolean isIdentifierStart(int codePoint) {
        return codePoint == '_' || Character.isUnicodeIdentifierStart(codePoint);
    }

    private static boolean isIdentifierPart(int codePoint) {
        return codePoint == '_' || Character.isUnicodeIdentifierPart(codePoint);
    }

    /** An odd number of trailing backslashes escapes the line break. */
    private static boolean endsWithEscape(String line) {
        int n = 0;
        for (int i = line.length() - 1; i >= 0 && line.charAt(i) == '\\'; i--) n++;
        return n % 2 == 1;
    }

    private static String stripTerminator(String line) {
        if (line.endsWith("\r\n")) return line.substring(0, line.length() - 2);
        if (line.endsWith("\n") || line.endsWith("\r")) return line.substring(0, line.length() - 1);
        return line;
    }
}
