/*
 * Copyright (c) 2025 SingleTuple4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.singletuple4j.spring;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.MeterRegistry;
import io.singletuple4j.core.api.model.Diagnostic;
import io.singletuple4j.core.report.Reporter;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

public final class MicrometerReporter implements Reporter {
    public static final String VIOLATIONS_METER = "singletuple4j_violations_total";

    private final MeterRegistry registry;
    private final Deque<Diagnostic> ring = new ArrayDeque<>();
    private final int capacity;

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "MeterRegistry is a framework-managed, thread-safe component; "
                    + "keeping a reference is required for metrics reporting and it is not exposed via accessors.")
    public MicrometerReporter(MeterRegistry registry, int capacity) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.capacity = Math.max(10, capacity);
    }

    @Override
    public synchronized void report(List<Diagnostic> diagnostics) {
        if (diagnostics == null || diagnostics.isEmpty()) return;
        for (Diagnostic d : diagnostics) {
            registry.counter(VIOLATIONS_METER, "rule", ruleCode(d.message())).increment();
            if (ring.size() >= capacity) ring.removeFirst();
            ring.addLast(d);
        }
    }

    /** Returns an unmodifiable snapshot of the recent diagnostics ring buffer. */
    public synchronized List<Diagnostic> recentDiagnostics() {
        return List.copyOf(ring);
    }

    // messages start with the rule code, e.g. "STC001 ..."
    private static String ruleCode(String message) {
        int space = message.indexOf(' ');
        return space > 0 ? message.substring(0, space) : message;
    }
}
