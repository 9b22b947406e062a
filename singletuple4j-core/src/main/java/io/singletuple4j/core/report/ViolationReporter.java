/*
 * Copyright (c) 2025 SingleTuple4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.singletuple4j.core.report;

import io.singletuple4j.core.api.model.Diagnostic;
import io.singletuple4j.core.api.model.Rule;
import io.singletuple4j.core.api.model.Violation;
import java.util.Objects;

/** Turns confirmed violations into diagnostics worded by the configured rule. */
public final class ViolationReporter {
    private final Rule rule;

    public ViolationReporter(Rule rule) {
        this.rule = Objects.requireNonNull(rule, "rule");
    }

    public Diagnostic toDiagnostic(Violation violation) {
        return new Diagnostic(violation.line(), violation.column(), violation.message(), rule.checkerName());
    }
}
