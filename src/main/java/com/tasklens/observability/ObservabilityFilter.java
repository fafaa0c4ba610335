package com.tasklens.observability;

import com.tasklens.config.TasklensProperties;
import io.micrometer.tracing.Tracer;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Request observability middleware. Wraps every inbound request exactly once, outside
 * Spring Security, so rejected requests are measured too.
 * <p>
 * On entry: correlation id, start time, server span, in-flight gauge, "Request started".
 * On exit, whether the chain returned or threw: one metrics sample, one summary event and
 * span close. Failures that escape the chain are rethrown unchanged, and a failure in this
 * bookkeeping is logged and dropped so it never replaces the real outcome.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class ObservabilityFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";

    private static final Logger log = LoggerFactory.getLogger(ObservabilityFilter.class);
    private static final EventLog events = EventLog.of(log);

    private final TasklensMetrics metrics;
    private final RequestTracer requestTracer;
    private final ClientAddressResolver clientAddressResolver;
    private final List<String> metricsExcludedPaths;

    public ObservabilityFilter(TasklensMetrics metrics,
                               RequestTracer requestTracer,
                               ClientAddressResolver clientAddressResolver,
                               TasklensProperties properties) {
        this.metrics = metrics;
        this.requestTracer = requestTracer;
        this.clientAddressResolver = clientAddressResolver;
        this.metricsExcludedPaths = List.copyOf(properties.getObservability().getMetricsExcludedPaths());
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        RequestContext context = new RequestContext(
                UUID.randomUUID().toString(),
                System.nanoTime(),
                request.getMethod(),
                request.getRequestURI(),
                clientAddressResolver.resolve(request),
                Math.max(0, request.getContentLengthLong()),
                request.getHeader("User-Agent"));
        request.setAttribute(RequestContext.ATTRIBUTE, context);
        response.setHeader(REQUEST_ID_HEADER, context.correlationId());

        ByteCountingResponseWrapper countingResponse = new ByteCountingResponseWrapper(response);
        boolean quiet = isExcluded(context.path());

        guard("open span", () -> requestTracer.openRequestSpan(request, context));
        guard("gauge", metrics::requestStarted);
        guard("start event", () -> events.log(quiet ? Level.DEBUG : Level.INFO, context, "Request started", null,
                "method", context.method(),
                "path", context.path(),
                "client_ip", context.clientAddress(),
                "user_agent", context.userAgent(),
                "request_size", context.requestSize()));

        Throwable escaped = null;
        try (Tracer.SpanInScope ignored = openScope(context)) {
            filterChain.doFilter(request, countingResponse);
        } catch (Throwable ex) {
            escaped = ex;
            throw ex;
        } finally {
            finish(request, countingResponse, context, escaped, quiet);
        }
    }

    private void finish(HttpServletRequest request, ByteCountingResponseWrapper response,
                        RequestContext context, Throwable escaped, boolean quiet) {
        try {
            Duration elapsed = context.elapsed();
            int status = escaped != null ? FailurePolicy.statusFor(escaped) : response.getStatus();
            Throwable failure = escaped != null ? escaped : context.failure().orElse(null);
            RequestOutcome outcome = FailurePolicy.outcomeFor(status, failure);
            String endpoint = EndpointResolver.resolve(request, status);
            if (escaped == null) {
                response.flushWriter();
            }
            long responseSize = response.getByteCount();
            String traceId = requestTracer.traceId(context);

            if (!quiet) {
                guard("request metrics", () -> metrics.recordRequest(
                        context.method(), endpoint, status, elapsed, context.requestSize(), responseSize));
            }
            if (escaped != null && outcome != RequestOutcome.CANCELED) {
                guard("error metrics", () -> metrics.recordError("request_error", "middleware"));
            }
            guard("summary event", () -> logSummary(context, endpoint, status, outcome, failure,
                    elapsed, responseSize, traceId, quiet));
            guard("close span", () -> requestTracer.closeRequestSpan(context, endpoint, status, outcome, failure));
        } catch (RuntimeException e) {
            log.warn("Observability bookkeeping failed for {} {}: {}", context.method(), context.path(), e.toString());
        } finally {
            guard("gauge", metrics::requestFinished);
        }
    }

    private void logSummary(RequestContext context, String endpoint, int status, RequestOutcome outcome,
                            Throwable failure, Duration elapsed, long responseSize, String traceId,
                            boolean quiet) {
        double durationMs = elapsed.toNanos() / 1_000_000.0;
        if (outcome == RequestOutcome.CANCELED) {
            events.warn(context, "Request canceled",
                    "method", context.method(),
                    "path", context.path(),
                    "endpoint", endpoint,
                    "status_code", status,
                    "duration_ms", durationMs,
                    "trace_id", traceId);
            return;
        }
        if (status < 400) {
            events.log(quiet ? Level.DEBUG : Level.INFO, context, "Request completed", null,
                    "method", context.method(),
                    "path", context.path(),
                    "endpoint", endpoint,
                    "status_code", status,
                    "duration_ms", durationMs,
                    "request_size", context.requestSize(),
                    "response_size", responseSize,
                    "trace_id", traceId);
            return;
        }
        Level level = FailurePolicy.levelFor(status, outcome);
        // Stack traces only for server-side failures; client errors are expected.
        Throwable cause = level == Level.ERROR ? failure : null;
        events.log(level, context, "Request failed", cause,
                "method", context.method(),
                "path", context.path(),
                "endpoint", endpoint,
                "status_code", status,
                "duration_ms", durationMs,
                "request_size", context.requestSize(),
                "response_size", responseSize,
                "error", failure != null ? describe(failure) : null,
                "trace_id", traceId);
    }

    private Tracer.SpanInScope openScope(RequestContext context) {
        try {
            return requestTracer.scope(context);
        } catch (RuntimeException e) {
            log.warn("Failed to put request span in scope: {}", e.getMessage());
            return RequestTracer.NO_SCOPE;
        }
    }

    private boolean isExcluded(String path) {
        return metricsExcludedPaths.contains(path);
    }

    private static String describe(Throwable failure) {
        String message = failure.getMessage();
        return message != null
                ? failure.getClass().getSimpleName() + ": " + message
                : failure.getClass().getSimpleName();
    }

    private static void guard(String step, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            log.warn("Observability bookkeeping failed at {}: {}", step, e.toString());
        }
    }
}
