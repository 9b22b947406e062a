/*
 * Copyright (c) 2025 SingleTuple4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.singletuple4j.spring;

import io.singletuple4j.core.api.SingleTupleChecker;
import java.util.HashMap;
import java.util.Map;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;

@Endpoint(id = "singletuple")
public class SingleTupleEndpoint {

    private final MicrometerReporter reporter;
    private final SingleTupleChecker checker;

    public SingleTupleEndpoint(MicrometerReporter reporter, SingleTupleChecker checker) {
        this.reporter = reporter;
        this.checker = checker;
    }

    @ReadOperation
    public Map<String, Object> info() {
        Map<String, Object> m = new HashMap<>();
        m.put("status", "OK");
        m.put("rule", checker.getRule().code());
        m.put("mode", checker.getMode().name());
        m.put("recentDiagnostics", reporter.recentDiagnostics());
        return m;
    }
}
