/*
 * Copyright (c) 2025 SingleTuple4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.singletuple4j.core.syntax;

public enum TokenKind {
    NAME,
    KEYWORD,
    NUMBER,
    STRING,
    OP,
    COMMENT,
    NEWLINE, // end of a logical line
    NL, // non-logical line break (blank line, inside brackets)
    INDENT,
    DEDENT,
    END_MARKER;

    /** Tokens that carry no expression meaning and are skipped when looking for an enclosing bracket. */
    public boolean isTrivia() {
        return switch (this) {
            case NL, COMMENT, INDENT, DEDENT -> true;
            case NAME, KEYWORD, NUMBER, STRING, OP, NEWLINE, END_MARKER -> false;
        };
    }
}
