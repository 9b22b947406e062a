/*
 * Copyright (c) 2025 SingleTuple4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.singletuple4j.spring;

import io.singletuple4j.core.api.model.Mode;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@ConfigurationProperties(prefix = "singletuple4j")
public class SingleTupleProperties {

    @Setter
    private boolean enabled = true;

    @Setter
    private Mode mode = Mode.BROAD;

    private Metrics metrics = new Metrics();

    public void setMetrics(Metrics metrics) {
        this.metrics = (metrics == null) ? new Metrics() : metrics;
    }

    // ---- nested: metrics ----
    @Getter
    @Setter
    public static final class Metrics {
        /** Size of the recent-diagnostics ring shown by the actuator endpoint. */
        private int recentCapacity = 200;
    }
}
