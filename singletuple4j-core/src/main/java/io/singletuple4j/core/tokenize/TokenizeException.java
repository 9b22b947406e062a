/*
 * Copyright (c) 2025 SingleTuple4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.singletuple4j.core.tokenize;

import io.singletuple4j.core.syntax.Position;

/** Raised when source lines cannot be split into tokens (unterminated literal, bad indentation, ...). */
public class TokenizeException extends Exception {
    private static final long serialVersionUID = 1L;

    private final transient Position position;

    public TokenizeException(String message, Position position) {
        super(message + " at " + position);
        this.position = position;
    }

    public Position getPosition() {
        return position;
    }
}
