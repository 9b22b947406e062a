/*
 * Copyright (c) 2025 SingleTuple4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.singletuple4j.spring.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.singletuple4j.core.api.SingleTupleChecker;
import io.singletuple4j.core.report.NoopReporter;
import io.singletuple4j.core.report.Reporter;
import io.singletuple4j.spring.MicrometerReporter;
import io.singletuple4j.spring.SingleTupleEndpoint;
import io.singletuple4j.spring.SingleTupleProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.autoconfigure.endpoint.condition.ConditionalOnAvailableEndpoint;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@AutoConfiguration(
        afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@EnableConfigurationProperties(SingleTupleProperties.class)
@ConditionalOnProperty(prefix = "singletuple4j", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SingleTupleAutoConfiguration {

    // MicrometerReporter, when registered below, is the Reporter
    @Bean
    @ConditionalOnMissingBean(Reporter.class)
    public Reporter singleTupleReporter() {
        return new NoopReporter();
    }

    @Bean
    @ConditionalOnMissingBean(SingleTupleChecker.class)
    public SingleTupleChecker singleTupleChecker(SingleTupleProperties props, Reporter reporter) {
        log.debug("Registering single-tuple checker in {} mode", props.getMode());
        return new SingleTupleChecker(props.getMode(), reporter);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MeterRegistry.class)
    static class MetricsConfiguration {

        // a user-supplied Reporter, Micrometer-backed or not, takes precedence
        @Bean
        @ConditionalOnBean(MeterRegistry.class)
        @ConditionalOnMissingBean(Reporter.class)
        public MicrometerReporter micrometerReporter(MeterRegistry registry, SingleTupleProperties props) {
            return new MicrometerReporter(registry, props.getMetrics().getRecentCapacity());
        }

        @Bean
        @ConditionalOnBean(MicrometerReporter.class)
        @ConditionalOnAvailableEndpoint(endpoint = SingleTupleEndpoint.class)
        public SingleTupleEndpoint singleTupleEndpoint(MicrometerReporter reporter, SingleTupleChecker checker) {
            return new SingleTupleEndpoint(reporter, checker);
        }
    }
}
