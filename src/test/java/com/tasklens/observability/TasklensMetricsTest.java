package com.tasklens.observability;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class TasklensMetricsTest {

    @Test
    void recordRequestCountsOncePerCall() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        TasklensMetrics metrics = new TasklensMetrics(registry, true);

        metrics.recordRequest("GET", "/api/v1/tasks", 200, Duration.ofMillis(12), 0, 512);
        metrics.recordRequest("GET", "/api/v1/tasks", 200, Duration.ofMillis(8), 0, 256);

        double count = registry.get(TasklensMetrics.REQUESTS)
                .tags("method", "GET", "endpoint", "/api/v1/tasks", "status_code", "200")
                .counter().count();
        assertEquals(2.0, count);
        assertEquals(2, registry.get(TasklensMetrics.REQUEST_DURATION).timer().count());
    }

    @Test
    void sizeHistogramsSkipEmptyBodies() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        TasklensMetrics metrics = new TasklensMetrics(registry, true);

        metrics.recordRequest("POST", "/api/v1/tasks", 201, Duration.ofMillis(5), 0, 128);

        assertNull(registry.find(TasklensMetrics.REQUEST_SIZE).summary());
        assertEquals(128.0, registry.get(TasklensMetrics.RESPONSE_SIZE).summary().totalAmount());
    }

    @Test
    void loginAttemptsAreSplitByOutcome() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        TasklensMetrics metrics = new TasklensMetrics(registry, true);

        metrics.recordLoginAttempt(true);
        metrics.recordLoginAttempt(false);
        metrics.recordLoginAttempt(false);

        assertEquals(1.0, registry.get(TasklensMetrics.LOGIN_ATTEMPTS).tag("status", "success").counter().count());
        assertEquals(2.0, registry.get(TasklensMetrics.LOGIN_ATTEMPTS).tag("status", "failure").counter().count());
    }

    @Test
    void activeConnectionsTracksInFlightRequests() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        TasklensMetrics metrics = new TasklensMetrics(registry, true);

        metrics.requestStarted();
        metrics.requestStarted();
        metrics.requestFinished();

        assertEquals(1.0, registry.get(TasklensMetrics.ACTIVE_CONNECTIONS).gauge().value());
    }

    @Test
    void disabledMetricsRegisterNothing() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        TasklensMetrics metrics = new TasklensMetrics(registry, false);

        metrics.requestStarted();
        metrics.recordRequest("GET", "/", 200, Duration.ofMillis(1), 10, 10);
        metrics.recordUserRegistration();
        metrics.recordLoginAttempt(true);
        metrics.recordApiCall("task_service", "create_task");
        metrics.recordError("request_error", "middleware");
        metrics.recordTaskDuration("task_creation", Duration.ofMillis(3));
        metrics.requestFinished();

        assertTrue(registry.getMeters().isEmpty());
        assertEquals("", metrics.exportText());
    }

    @Test
    void exportUsesPrometheusNames() {
        PrometheusMeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        TasklensMetrics metrics = new TasklensMetrics(registry, true);

        metrics.recordRequest("POST", "/api/v1/tasks", 201, Duration.ofMillis(20), 64, 128);
        metrics.recordUserRegistration();
        metrics.recordLoginAttempt(false);
        metrics.recordApiCall("task_service", "create_task");
        metrics.recordError("persistence_error", "database");
        metrics.recordTaskDuration("task_creation", Duration.ofMillis(15));

        String text = metrics.exportText();
        assertTrue(text.contains("http_requests_total{"));
        assertTrue(text.contains("status_code=\"201\""));
        assertTrue(text.contains("http_request_duration_seconds_bucket{"));
        assertTrue(text.contains("http_request_size_bytes"));
        assertTrue(text.contains("http_response_size_bytes"));
        assertTrue(text.contains("active_connections"));
        assertTrue(text.contains("user_registrations_total"));
        assertTrue(text.contains("login_attempts_total{"));
        assertTrue(text.contains("api_calls_total{"));
        assertTrue(text.contains("errors_total{"));
        assertTrue(text.contains("task_duration_seconds"));
    }

    @Test
    void exportIsEmptyForNonPrometheusRegistry() {
        TasklensMetrics metrics = new TasklensMetrics(new SimpleMeterRegistry(), true);
        metrics.recordUserRegistration();
        assertEquals("", metrics.exportText());
    }
}
