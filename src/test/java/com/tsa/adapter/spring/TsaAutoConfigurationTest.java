package com.tsa.adapter.spring;

import com.tsa.collection.AnalysisRunner;
import com.tsa.config.AnalysisConfig;
import com.tsa.interval.InMemoryIntervalSource;
import com.tsa.interval.IntervalSource;
import com.tsa.interval.JsonIntervalSource;
import com.tsa.result.ReportWriter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TsaAutoConfiguration.
 */
class TsaAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(TsaAutoConfiguration.class));

    @Test
    @DisplayName("Should create analysis beans from the default definition")
    void shouldCreateBeans() {
        contextRunner.run(context -> {
            assertNotNull(context.getBean(AnalysisRunner.class));
            assertNotNull(context.getBean(ReportWriter.class));
            assertEquals("winter-friction-2018", context.getBean(AnalysisConfig.class).name());
            assertInstanceOf(InMemoryIntervalSource.class, context.getBean(IntervalSource.class));
        });
    }

    @Test
    @DisplayName("Should load interval data when a path is configured")
    void shouldLoadIntervals() {
        contextRunner
                .withPropertyValues("tsa.intervals-path=classpath:intervals-test.json",
                        "tsa.config-path=classpath:analysis-test.yaml")
                .run(context -> {
                    assertInstanceOf(JsonIntervalSource.class, context.getBean(IntervalSource.class));
                    assertEquals("test-analysis", context.getBean(AnalysisConfig.class).name());
                });
    }

    @Test
    @DisplayName("Should create nothing when disabled")
    void shouldBackOffWhenDisabled() {
        contextRunner
                .withPropertyValues("tsa.enabled=false")
                .run(context -> assertTrue(context.getBeansOfType(AnalysisRunner.class).isEmpty()));
    }
}
