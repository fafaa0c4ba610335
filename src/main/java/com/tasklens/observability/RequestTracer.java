package com.tasklens.observability;

import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import io.micrometer.tracing.propagation.Propagator;
import jakarta.servlet.http.HttpServletRequest;

import java.util.Locale;
import java.util.function.Supplier;

/**
 * Opens one server span per request, continuing an inbound W3C trace context when present,
 * and hands child spans to downstream collaborators.
 * <p>
 * When tracing is disabled nothing is created: the context reports no span and
 * {@link #inChildSpan} simply runs its body.
 */
public class RequestTracer {

    static final Tracer.SpanInScope NO_SCOPE = () -> { };

    private final Tracer tracer;
    private final Propagator propagator;
    private final boolean enabled;

    public RequestTracer(Tracer tracer, Propagator propagator, boolean enabled) {
        this.tracer = tracer;
        this.propagator = propagator;
        this.enabled = enabled;
    }

    public void openRequestSpan(HttpServletRequest request, RequestContext context) {
        if (!enabled) return;

        Span.Builder builder = hasInboundContext(request)
                ? propagator.extract(request, HttpServletRequest::getHeader)
                : tracer.spanBuilder().setNoParent();
        Span span = builder
                .name("http " + context.method().toLowerCase(Locale.ROOT))
                .kind(Span.Kind.SERVER)
                .tag("http.method", context.method())
                .tag("client.address", context.clientAddress())
                .tag(EventLog.REQUEST_ID_KEY, context.correlationId())
                .start();
        context.attachSpan(span);
    }

    /**
     * Puts the request span in scope for the current thread. Always close the returned scope
     * before the request span is closed.
     */
    public Tracer.SpanInScope scope(RequestContext context) {
        return context.span()
                .map(tracer::withSpan)
                .orElse(NO_SCOPE);
    }

    /**
     * Tags the request span with its outcome and ends it. Calling this twice is harmless:
     * the span is detached from the context on the first call.
     */
    public void closeRequestSpan(RequestContext context, String route, int status,
                                 RequestOutcome outcome, Throwable failure) {
        Span span = context.span().orElse(null);
        if (span == null) return;
        context.attachSpan(null);

        span.name(context.method() + " " + route)
                .tag("http.route", route)
                .tag("http.status_code", String.valueOf(status))
                .tag("outcome", outcome.tagValue());
        if (outcome != RequestOutcome.OK) {
            if (failure != null) {
                span.error(failure);
            } else {
                span.tag("error", "HTTP " + status);
            }
        }
        span.end();
    }

    /**
     * Runs {@code body} inside a child of the active span, recording the operation name and
     * any failure, which is rethrown unchanged.
     */
    public <T> T inChildSpan(RequestContext context, String name, Supplier<T> body) {
        if (!enabled) return body.get();

        Span parent = tracer.currentSpan();
        if (parent == null) {
            parent = context.span().orElse(null);
        }
        if (parent == null) return body.get();

        Span child = tracer.nextSpan(parent).name(name).tag("function.name", name).start();
        try (Tracer.SpanInScope ignored = tracer.withSpan(child)) {
            T result = body.get();
            child.tag("function.result", result == null ? "void" : result.getClass().getSimpleName());
            child.tag("outcome", RequestOutcome.OK.tagValue());
            return result;
        } catch (RuntimeException e) {
            child.tag("outcome", RequestOutcome.ERROR.tagValue());
            child.error(e);
            throw e;
        } finally {
            child.end();
        }
    }

    /**
     * Current trace id for log correlation, or {@code null} when no span is active.
     */
    public String traceId(RequestContext context) {
        return context.span().map(span -> span.context().traceId()).orElse(null);
    }

    private boolean hasInboundContext(HttpServletRequest request) {
        for (String field : propagator.fields()) {
            if (request.getHeader(field) != null) {
                return true;
            }
        }
        return false;
    }
}
