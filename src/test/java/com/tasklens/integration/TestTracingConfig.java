package com.tasklens.integration;

import io.micrometer.tracing.test.simple.SimpleTracer;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;

/**
 * In-memory tracer so tests can inspect request spans without an OTLP collector.
 */
@TestConfiguration
public class TestTracingConfig {

    @Bean
    public SimpleTracer simpleTracer() {
        return new SimpleTracer();
    }
}
