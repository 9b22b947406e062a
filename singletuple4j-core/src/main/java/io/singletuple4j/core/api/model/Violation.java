/*
 * Copyright (c) 2025 SingleTuple4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.singletuple4j.core.api.model;

/** A confirmed finding at the opening parenthesis of a redundant pair. */
public record Violation(int line, int column, String ruleId, String message) {}
