/*
 * Copyright (c) 2025 SingleTuple4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.singletuple4j.spring.config;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.singletuple4j.core.api.SingleTupleChecker;
import io.singletuple4j.core.api.model.Diagnostic;
import io.singletuple4j.core.api.model.Mode;
import io.singletuple4j.core.parse.SourceParser;
import io.singletuple4j.core.report.NoopReporter;
import io.singletuple4j.core.report.Reporter;
import io.singletuple4j.spring.MicrometerReporter;
import io.singletuple4j.spring.SingleTupleEndpoint;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class SingleTupleAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(SingleTupleAutoConfiguration.class));

    @Test
    void testDefaults() {
        runner.run(context -> {
            assertThat(context).hasSingleBean(SingleTupleChecker.class);
            assertThat(context).hasSingleBean(Reporter.class);
            assertThat(context.getBean(Reporter.class)).isInstanceOf(NoopReporter.class);
            assertThat(context).doesNotHaveBean(MicrometerReporter.class);
            assertThat(context).doesNotHaveBean(SingleTupleEndpoint.class);

            SingleTupleChecker checker = context.getBean(SingleTupleChecker.class);
            assertThat(checker.getMode()).isEqualTo(Mode.BROAD);
            assertThat(checker.getRule().code()).isEqualTo("STC001");
        });
    }

    @Test
    void testModeProperty() {
        runner.withPropertyValues("singletuple4j.mode=strings-only").run(context -> {
            assertThat(context.getBean(SingleTupleChecker.class).getMode()).isEqualTo(Mode.STRINGS_ONLY);
        });
    }

    @Test
    void testDisabled() {
        runner.withPropertyValues("singletuple4j.enabled=false").run(context -> {
            assertThat(context).doesNotHaveBean(SingleTupleChecker.class);
            assertThat(context).doesNotHaveBean(Reporter.class);
        });
    }

    @Test
    void testMeterRegistryEnablesMicrometerReporter() {
        runner.withBean(MeterRegistry.class, SimpleMeterRegistry::new).run(context -> {
            assertThat(context).hasSingleBean(Reporter.class);
            assertThat(context.getBean(Reporter.class)).isInstanceOf(MicrometerReporter.class);

            String source = "x = (\"a\")\n";
            List<String> lines = source.lines().toList();
            List<Diagnostic> found =
                    context.getBean(SingleTupleChecker.class).check(SourceParser.parse(source), lines);
            assertThat(found).hasSize(1);

            MeterRegistry registry = context.getBean(MeterRegistry.class);
            assertThat(registry.counter(MicrometerReporter.VIOLATIONS_METER, "rule", "STC001").count())
                    .isEqualTo(1.0);
            assertThat(context.getBean(MicrometerReporter.class).recentDiagnostics()).isEqualTo(found);
        });
    }

    @Test
    void testRecentCapacityProperty() {
        runner.withBean(MeterRegistry.class, SimpleMeterRegistry::new)
                .withPropertyValues("singletuple4j.metrics.recent-capacity=12")
                .run(context -> {
                    MicrometerReporter reporter = context.getBean(MicrometerReporter.class);
                    List<Diagnostic> batch = new ArrayList<>();
                    for (int i = 1; i <= 20; i++) {
                        batch.add(new Diagnostic(i, 4, "STC001 x", "single-tuple"));
                    }
                    reporter.report(batch);
                    assertThat(reporter.recentDiagnostics()).hasSize(12);
                });
    }

    @Test
    void testUserReporterWins() {
        List<Diagnostic> reported = new ArrayList<>();
        Reporter custom = reported::addAll;
        runner.withBean(Reporter.class, () -> custom).run(context -> {
            assertThat(context).hasSingleBean(Reporter.class);
            assertThat(context.getBean(Reporter.class)).isSameAs(custom);

            String source = "if a in (\"b\"):\n    pass\n";
            context.getBean(SingleTupleChecker.class)
                    .check(SourceParser.parse(source), source.lines().toList());
            assertThat(reported).hasSize(1);
        });
    }

    @Test
    void testUserReporterWinsOverMicrometer() {
        Reporter custom = diagnostics -> { };
        runner.withBean(MeterRegistry.class, SimpleMeterRegistry::new)
                .withBean(Reporter.class, () -> custom)
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context).hasSingleBean(Reporter.class);
                    assertThat(context.getBean(Reporter.class)).isSameAs(custom);
                    assertThat(context).doesNotHaveBean(MicrometerReporter.class);
                    assertThat(context).doesNotHaveBean(SingleTupleEndpoint.class);
                    assertThat(context).hasSingleBean(SingleTupleChecker.class);
                });
    }

    @Test
    void testUserMicrometerReporterIsUsed() {
        runner.withBean(MeterRegistry.class, SimpleMeterRegistry::new)
                .withBean(MicrometerReporter.class, () -> new MicrometerReporter(new SimpleMeterRegistry(), 20))
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context).hasSingleBean(Reporter.class);
                    assertThat(context).hasSingleBean(SingleTupleChecker.class);
                });
    }

    @Test
    void testUserCheckerWins() {
        SingleTupleChecker custom = new SingleTupleChecker();
        runner.withBean(SingleTupleChecker.class, () -> custom).run(context -> {
            assertThat(context.getBean(SingleTupleChecker.class)).isSameAs(custom);
        });
    }

    @Test
    void testEndpointRegisteredWhenExposed() {
        runner.withBean(MeterRegistry.class, SimpleMeterRegistry::new)
                .withPropertyValues("management.endpoints.web.exposure.include=singletuple")
                .run(context -> assertThat(context).hasSingleBean(SingleTupleEndpoint.class));
    }

    @Test
    void testEndpointNotRegisteredWithoutExposure() {
        runner.withBean(MeterRegistry.class, SimpleMeterRegistry::new)
                .run(context -> assertThat(context).doesNotHaveBean(SingleTupleEndpoint.class));
    }
}
