/*
 * Copyright (c) 2025 SingleTuple4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.singletuple4j.core.api.model;

/** A reported problem: 1-based line, 0-based column, full message text and the checker that produced it. */
public record Diagnostic(int line, int column, String message, String checker) {}
