package com.tasklens.observability;

import io.micrometer.tracing.Span;
import jakarta.servlet.ServletRequest;

import java.time.Duration;
import java.util.Optional;

/**
 * Per-request observability state. Created by {@link ObservabilityFilter} on entry, passed
 * explicitly to controllers and services, and dropped when the request completes.
 * Never stored anywhere that outlives the request.
 */
public final class RequestContext {

    public static final String ATTRIBUTE = RequestContext.class.getName();

    private final String correlationId;
    private final long startNanos;
    private final String method;
    private final String path;
    private final String clientAddress;
    private final long requestSize;
    private final String userAgent;

    private Span span;
    private Long userId;
    private Throwable failure;

    public RequestContext(String correlationId, long startNanos, String method, String path,
                          String clientAddress, long requestSize, String userAgent) {
        this.correlationId = correlationId;
        this.startNanos = startNanos;
        this.method = method;
        this.path = path;
        this.clientAddress = clientAddress;
        this.requestSize = requestSize;
        this.userAgent = userAgent;
    }

    /**
     * Context with no span and no client details, for work that runs outside an HTTP request.
     */
    public static RequestContext detached(String correlationId) {
        return new RequestContext(correlationId, System.nanoTime(), "NONE", "", "unknown", 0, null);
    }

    public static Optional<RequestContext> from(ServletRequest request) {
        return Optional.ofNullable((RequestContext) request.getAttribute(ATTRIBUTE));
    }

    public String correlationId() { return correlationId; }
    public long startNanos() { return startNanos; }
    public String method() { return method; }
    public String path() { return path; }
    public String clientAddress() { return clientAddress; }
    public long requestSize() { return requestSize; }
    public String userAgent() { return userAgent; }

    public Duration elapsed() {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    /**
     * The request's span, or empty when tracing is disabled.
     */
    public Optional<Span> span() { return Optional.ofNullable(span); }

    void attachSpan(Span span) { this.span = span; }

    public Optional<Long> userId() { return Optional.ofNullable(userId); }

    public void bindUser(Long userId) { this.userId = userId; }

    public Optional<Throwable> failure() { return Optional.ofNullable(failure); }

    /**
     * Records the cause of a failure that was turned into a response further down the chain,
     * so the request summary can report it.
     */
    public void recordFailure(Throwable failure) { this.failure = failure; }
}
