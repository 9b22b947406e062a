/*
 * Copyright (c) 2025 SingleTuple4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.singletuple4j.core.detect;

/** Syntactic position that makes an expression worth inspecting. */
public enum SiteContext {
    ASSIGNMENT_VALUE,
    MEMBERSHIP_LEFT,
    MEMBERSHIP_RIGHT,
    CALL_ARGUMENT;

    public boolean isMembership() {
        return this == MEMBERSHIP_LEFT || this == MEMBERSHIP_RIGHT;
    }
}
