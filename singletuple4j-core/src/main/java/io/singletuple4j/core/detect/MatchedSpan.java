/*
 * Copyright (c) 2025 SingleTuple4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.singletuple4j.core.detect;

import java.util.OptionalInt;

/**
 * Token indices of the parenthesis pair wrapping a candidate. {@code outerOpen} is present for call
 * arguments only and points at the call's own opening parenthesis.
 */
public record MatchedSpan(int open, int close, OptionalInt outerOpen) {}
