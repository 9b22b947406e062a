/*
 * Copyright (c) 2025 SingleTuple4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.singletuple4j.core.syntax;

import java.util.Objects;

/** An immutable lexical token; {@code end} is exclusive. */
public record Token(TokenKind kind, String text, Position start, Position end) {

    public Token {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
    }

    public boolean is(TokenKind k, String t) {
        return kind == k && text.equals(t);
    }

    public boolean isOp(String t) {
        return is(TokenKind.OP, t);
    }

    public boolean isKeyword(String t) {
        return is(TokenKind.KEYWORD, t);
    }

    public boolean isOpeningBracket() {
        return kind == TokenKind.OP && (text.equals("(") || text.equals("[") || text.equals("{"));
    }

    public boolean isClosingBracket() {
        return kind == TokenKind.OP && (text.equals(")") || text.equals("]") || text.equals("}"));
    }
}
