/*
 * Copyright (c) 2025 SingleTuple4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.singletuple4j.core.parse;

import io.singletuple4j.core.syntax.Position;
import io.singletuple4j.core.tokenize.TokenizeException;
import lombok.Getter;

/** Source text that {@link SourceParser} cannot turn into a tree. */
@Getter
public class ParseException extends Exception {
    private static final long serialVersionUID = 1L;

    private final int line;
    private final int column;

    public ParseException(String message, Position position) {
        super(message + " at " + position);
        this.line = position.line();
        this.column = position.column();
    }

    public ParseException(TokenizeException cause) {
        super(cause.getMessage(), cause);
        this.line = cause.getPosition().line();
        this.column = cause.getPosition().column();
    }
}
