/*
 * Copyright (c) 2025 SingleTuple4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.singletuple4j.core.api.model;

/** How wide the net is cast when choosing which parenthesized expressions to inspect. */
public enum Mode {
    /** Strings, constants, names, attributes, subscripts, calls, lambdas and generators. */
    BROAD,
    /** Only string literals and f-strings, in every context. */
    STRINGS_ONLY
}
