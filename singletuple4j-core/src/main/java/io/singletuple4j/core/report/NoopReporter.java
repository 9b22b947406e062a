/*
 * Copyright (c) 2025 SingleTuple4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.singletuple4j.core.report;

import io.singletuple4j.core.api.model.Diagnostic;
import java.util.List;

public final class NoopReporter implements Reporter {
    @Override
    public void report(List<Diagnostic> diagnostics) {
        /* no-op */
    }
}
