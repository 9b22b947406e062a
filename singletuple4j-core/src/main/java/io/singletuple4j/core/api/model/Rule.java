/*
 * Copyright (c) 2025 SingleTuple4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.singletuple4j.core.api.model;

import java.util.Objects;

/** Identity and wording of a rule as it appears in diagnostics. */
public record Rule(String code, String message, String checkerName, String version) {

    public static final String STC001_MESSAGE =
            "STC001 single-item tuple missing trailing comma; did you mean `(x,)`?";

    public Rule {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(checkerName, "checkerName");
        Objects.requireNonNull(version, "version");
    }

    public static Rule stc001() {
        return new Rule("STC001", STC001_MESSAGE, "single-tuple", "1.1.0");
    }
}
