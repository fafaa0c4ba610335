package com.tasklens.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Request and business metrics for tasklens.
 * <p>
 * When disabled, every recording method returns after the flag check and no meter is
 * ever registered. Meter names follow Micrometer dotted naming and render in the Prometheus
 * exposition as {@code http_requests_total}, {@code http_request_duration_seconds}, and so on.
 */
public class TasklensMetrics {

    public static final String REQUESTS = "http.requests";
    public static final String REQUEST_DURATION = "http.request.duration";
    public static final String REQUEST_SIZE = "http.request.size";
    public static final String RESPONSE_SIZE = "http.response.size";
    public static final String ACTIVE_CONNECTIONS = "active.connections";
    public static final String USER_REGISTRATIONS = "user.registrations";
    public static final String LOGIN_ATTEMPTS = "login.attempts";
    public static final String API_CALLS = "api.calls";
    public static final String ERRORS = "errors";
    public static final String TASK_DURATION = "task.duration";

    private final MeterRegistry registry;
    private final boolean enabled;
    private final AtomicLong activeConnections = new AtomicLong(0);

    public TasklensMetrics(MeterRegistry registry, boolean enabled) {
        this.registry = registry;
        this.enabled = enabled;
        if (enabled) {
            registry.gauge(ACTIVE_CONNECTIONS, activeConnections);
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    // --- HTTP request metrics ---

    public void recordRequest(String method, String endpoint, int statusCode, Duration duration,
                              long requestSize, long responseSize) {
        if (!enabled) return;

        Counter.builder(REQUESTS)
                .description("Total number of HTTP requests")
                .tag("method", method)
                .tag("endpoint", endpoint)
                .tag("status_code", String.valueOf(statusCode))
                .register(registry).increment();

        Timer.builder(REQUEST_DURATION)
                .description("HTTP request duration")
                .tag("method", method)
                .tag("endpoint", endpoint)
                .publishPercentileHistogram()
                .register(registry).record(duration);

        if (requestSize > 0) {
            DistributionSummary.builder(REQUEST_SIZE)
                    .description("HTTP request size")
                    .baseUnit("bytes")
                    .tag("method", method)
                    .tag("endpoint", endpoint)
                    .register(registry).record(requestSize);
        }
        if (responseSize > 0) {
            DistributionSummary.builder(RESPONSE_SIZE)
                    .description("HTTP response size")
                    .baseUnit("bytes")
                    .tag("method", method)
                    .tag("endpoint", endpoint)
                    .register(registry).record(responseSize);
        }
    }

    public void requestStarted() {
        if (!enabled) return;
        activeConnections.incrementAndGet();
    }

    public void requestFinished() {
        if (!enabled) return;
        activeConnections.decrementAndGet();
    }

    // --- Business metrics ---

    public void recordUserRegistration() {
        if (!enabled) return;
        Counter.builder(USER_REGISTRATIONS)
                .description("Total number of user registrations")
                .register(registry).increment();
    }

    public void recordLoginAttempt(boolean success) {
        if (!enabled) return;
        Counter.builder(LOGIN_ATTEMPTS)
                .description("Total number of login attempts")
                .tag("status", success ? "success" : "failure")
                .register(registry).increment();
    }

    public void recordApiCall(String service, String operation) {
        if (!enabled) return;
        Counter.builder(API_CALLS)
                .description("Total number of API calls")
                .tag("service", service)
                .tag("operation", operation)
                .register(registry).increment();
    }

    public void recordError(String errorType, String service) {
        if (!enabled) return;
        Counter.builder(ERRORS)
                .description("Total number of errors")
                .tag("error_type", errorType)
                .tag("service", service)
                .register(registry).increment();
    }

    public void recordTaskDuration(String taskName, Duration duration) {
        if (!enabled) return;
        Timer.builder(TASK_DURATION)
                .description("Task execution duration")
                .tag("task_name", taskName)
                .register(registry).record(duration);
    }

    // --- Export ---

    /**
     * Renders the registry in the Prometheus text exposition format, or an empty string
     * when metrics are disabled or the registry cannot scrape.
     */
    public String exportText() {
        if (!enabled) return "";
        if (registry instanceof PrometheusMeterRegistry prometheus) {
            return prometheus.scrape();
        }
        return "";
    }
}
