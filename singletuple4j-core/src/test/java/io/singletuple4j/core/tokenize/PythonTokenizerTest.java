/*
 * Copyright (c) 2025 SingleTuple4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.singletuple4j.core.tokenize;

import static org.junit.jupiter.api.Assertions.*;

import io.singletuple4j.core.syntax.Position;
import io.singletuple4j.core.syntax.Token;
import io.singletuple4j.core.syntax.TokenKind;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class PythonTokenizerTest {

    private static List<TokenKind> kinds(String source) throws TokenizeException {
        return PythonTokenizer.tokenize(source).stream().map(Token::kind).collect(Collectors.toList());
    }

    private static List<String> texts(String source) throws TokenizeException {
        return PythonTokenizer.tokenize(source).stream()
                .filter(t -> t.kind() != TokenKind.NEWLINE && t.kind() != TokenKind.END_MARKER)
                .map(Token::text)
                .collect(Collectors.toList());
    }

    private static void error(String source, String message) {
        TokenizeException e = assertThrows(TokenizeException.class, () -> PythonTokenizer.tokenize(source));
        assertTrue(e.getMessage().startsWith(message), e.getMessage());
    }

    @Test
    void testSimpleStatement() throws Exception {
        assertEquals(
                List.of(
                        TokenKind.NAME,
                        TokenKind.OP,
                        TokenKind.OP,
                        TokenKind.STRING,
                        TokenKind.OP,
                        TokenKind.OP,
                        TokenKind.COMMENT,
                        TokenKind.NEWLINE,
                        TokenKind.END_MARKER),
                kinds("x = (\"a\",)  # c"));
    }

    @Test
    void testPositions() throws Exception {
        List<Token> tokens = PythonTokenizer.tokenize("x = (\"a\")");
        assertEquals(Position.of(1, 4), tokens.get(2).start());
        assertEquals(Position.of(1, 5), tokens.get(3).start());
        assertEquals(Position.of(1, 8), tokens.get(3).end());
        assertEquals(Position.of(2, 0), tokens.get(tokens.size() - 1).start());
    }

    @Test
    void testKeywords() throws Exception {
        assertEquals(
                List.of(TokenKind.KEYWORD, TokenKind.NAME, TokenKind.KEYWORD, TokenKind.KEYWORD),
                kinds("not x is None").subList(0, 4));
        assertEquals(TokenKind.NAME, kinds("match = 1").get(0));
    }

    @Test
    void testLongestOperatorMatch() throws Exception {
        assertEquals(List.of("a", "//=", "b", "**", "c", "->", "d", "...", "!="), texts("a //= b ** c -> d ... !="));
    }

    @Test
    void testStringPrefixes() throws Exception {
        assertEquals(List.of("rb'x'", "F\"y\"", "u'z'"), texts("rb'x' F\"y\" u'z'"));
        assertEquals(List.of("bad", "'x'"), texts("bad'x'"));
    }

    @Test
    void testEscapedQuote() throws Exception {
        assertEquals(List.of("'it\\'s'"), texts("'it\\'s'"));
    }

    @Test
    void testTripleQuotedString() throws Exception {
        List<Token> tokens = PythonTokenizer.tokenize("s = \"\"\"a\nb\"\"\"\n");
        Token string = tokens.get(2);
        assertEquals(TokenKind.STRING, string.kind());
        assertEquals("\"\"\"a\nb\"\"\"", string.text());
        assertEquals(Position.of(1, 4), string.start());
        assertEquals(Position.of(2, 4), string.end());
        assertEquals(TokenKind.NEWLINE, tokens.get(3).kind());
    }

    @Test
    void testNumbers() throws Exception {
        assertEquals(List.of("1e-5", "+", "0x1e", "+", "1", "3.14j", ".5", "1_000"), texts("1e-5 + 0x1e+1 3.14j .5 1_000"));
    }

    @Test
    void testLineBreaksInsideBrackets() throws Exception {
        assertEquals(
                List.of(
                        TokenKind.NAME,
                        TokenKind.OP,
                        TokenKind.NL,
                        TokenKind.NUMBER,
                        TokenKind.OP,
                        TokenKind.NEWLINE,
                        TokenKind.END_MARKER),
                kinds("f(\n1)"));
    }

    @Test
    void testIndentation() throws Exception {
        List<TokenKind> kinds = kinds("if x:\n    y\nz");
        assertEquals(
                List.of(
                        TokenKind.KEYWORD,
                        TokenKind.NAME,
                        TokenKind.OP,
                        TokenKind.NEWLINE,
                        TokenKind.INDENT,
                        TokenKind.NAME,
                        TokenKind.NEWLINE,
                        TokenKind.DEDENT,
                        TokenKind.NAME,
                        TokenKind.NEWLINE,
                        TokenKind.END_MARKER),
                kinds);
    }

    @Test
    void testDedentAtEndOfInput() throws Exception {
        List<Token> tokens = PythonTokenizer.tokenize("if x:\n    y\n");
        Token dedent = tokens.get(tokens.size() - 2);
        Token end = tokens.get(tokens.size() - 1);
        assertEquals(TokenKind.DEDENT, dedent.kind());
        assertEquals(TokenKind.END_MARKER, end.kind());
        assertEquals(dedent.start(), end.start());
    }

    @Test
    void testBlankAndCommentLinesDoNotIndent() throws Exception {
        List<TokenKind> kinds = kinds("x\n\n   # c\ny");
        assertFalse(kinds.contains(TokenKind.INDENT));
        assertEquals(
                List.of(
                        TokenKind.NAME,
                        TokenKind.NEWLINE,
                        TokenKind.NL,
                        TokenKind.COMMENT,
                        TokenKind.NL,
                        TokenKind.NAME,
                        TokenKind.NEWLINE,
                        TokenKind.END_MARKER),
                kinds);
    }

    @Test
    void testBackslashContinuation() throws Exception {
        List<TokenKind> kinds = kinds("x = 1 + \\\n    2");
        assertEquals(1, kinds.stream().filter(k -> k == TokenKind.NEWLINE).count());
        assertFalse(kinds.contains(TokenKind.INDENT));
    }

    @Test
    void testLineTerminatorsAreStripped() throws Exception {
        List<Token> tokens = PythonTokenizer.tokenize(List.of("x = 1\r\n", "y\n"));
        assertEquals("y", tokens.get(4).text());
        assertEquals(Position.of(2, 0), tokens.get(4).start());
    }

    @Test
    void testErrors() {
        error("x = \"abc", "unterminated string literal");
        error("s = \"\"\"abc", "EOF in multi-line string");
        error("f(1,", "EOF in multi-line statement");
        error("x)", "unmatched ')'");
        error("(]", "closing parenthesis ']'");
        error("if x:\n    a\n  b", "unindent does not match");
        error("x = $y", "invalid character");
        error("x = 1 \\ 2", "unexpected character after line continuation");
    }

    @Test
    void testErrorPosition() {
        TokenizeException e = assertThrows(TokenizeException.class, () -> PythonTokenizer.tokenize("x = 1\ny = 'a"));
        assertEquals(Position.of(2, 4), e.getPosition());
    }

    @Test
    void testFormattedStringWithNestedQuotes() throws Exception {
        assertEquals(List.of("x", "=", "f\"{d[\"k\"]}\""), texts("x = f\"{d[\"k\"]}\""));
        assertEquals(List.of("f'{a:{w}}'", "+", "'b'"), texts("f'{a:{w}}' + 'b'"));
        assertEquals(List.of("rf\"{x[\"a\"]}\\d\""), texts("rf\"{x[\"a\"]}\\d\""));
    }

    @Test
    void testFormattedStringLiteralBraces() throws Exception {
        // '{{' opens no replacement field, so the quote closes the literal
        assertEquals(List.of("f\"{{\"", "+", "\"}\""), texts("f\"{{\" + \"}\""));
        // plain strings never track braces
        assertEquals(List.of("\"{\"", ",", "\"}\""), texts("\"{\", \"}\""));
    }

    @Test
    void testSupplementaryIdentifier() throws Exception {
        // U+1D518 MATHEMATICAL FRAKTUR CAPITAL U, a surrogate pair in UTF-16
        String name = "\uD835\uDD18x";
        List<Token> tokens = PythonTokenizer.tokenize(name + " = (\"a\")");
        assertEquals(TokenKind.NAME, tokens.get(0).kind());
        assertEquals(name, tokens.get(0).text());
        assertEquals(Position.of(1, 3), tokens.get(0).end());
        assertEquals(Position.of(1, 6), tokens.get(2).start());
    }
}
