/*
 * Copyright (c) 2025 SingleTuple4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.singletuple4j.core.syntax;

public enum BooleanOperator {
    AND,
    OR
}
