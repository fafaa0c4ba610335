package com.tasklens.observability;

import io.micrometer.tracing.Span;
import io.micrometer.tracing.propagation.Propagator;
import io.micrometer.tracing.test.simple.SimpleSpan;
import io.micrometer.tracing.test.simple.SimpleTracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class RequestTracerTest {

    private SimpleTracer tracer;
    private RequestTracer requestTracer;

    @BeforeEach
    void setUp() {
        tracer = new SimpleTracer();
        requestTracer = new RequestTracer(tracer, Propagator.NOOP, true);
    }

    private static RequestContext context(String method, String path) {
        return new RequestContext("req-1", System.nanoTime(), method, path, "10.0.0.1", 0, "junit");
    }

    @Test
    void opensServerSpanWithRequestAttributes() {
        RequestContext context = context("POST", "/api/v1/tasks");

        requestTracer.openRequestSpan(new MockHttpServletRequest("POST", "/api/v1/tasks"), context);

        SimpleSpan span = (SimpleSpan) context.span().orElseThrow();
        assertEquals(Span.Kind.SERVER, span.getKind());
        assertEquals("POST", span.getTags().get("http.method"));
        assertEquals("10.0.0.1", span.getTags().get("client.address"));
        assertEquals("req-1", span.getTags().get("request_id"));
    }

    @Test
    void closeTagsRouteAndStatusAndDetachesSpan() {
        RequestContext context = context("GET", "/api/v1/tasks/5");
        requestTracer.openRequestSpan(new MockHttpServletRequest("GET", "/api/v1/tasks/5"), context);
        SimpleSpan span = (SimpleSpan) context.span().orElseThrow();

        requestTracer.closeRequestSpan(context, "/api/v1/tasks/{taskId}", 200, RequestOutcome.OK, null);

        assertEquals("GET /api/v1/tasks/{taskId}", span.getName());
        assertEquals("/api/v1/tasks/{taskId}", span.getTags().get("http.route"));
        assertEquals("200", span.getTags().get("http.status_code"));
        assertEquals("ok", span.getTags().get("outcome"));
        assertNull(span.getError());
        assertTrue(context.span().isEmpty());

        // second close is a no-op
        requestTracer.closeRequestSpan(context, "/other", 500, RequestOutcome.ERROR, new RuntimeException());
        assertEquals("200", span.getTags().get("http.status_code"));
    }

    @Test
    void serverErrorMarksSpanWithFailure() {
        RequestContext context = context("GET", "/api/v1/tasks");
        requestTracer.openRequestSpan(new MockHttpServletRequest("GET", "/api/v1/tasks"), context);
        SimpleSpan span = (SimpleSpan) context.span().orElseThrow();
        IllegalStateException failure = new IllegalStateException("db down");

        requestTracer.closeRequestSpan(context, "/api/v1/tasks", 503, RequestOutcome.ERROR, failure);

        assertSame(failure, span.getError());
        assertEquals("error", span.getTags().get("outcome"));
    }

    @Test
    void clientErrorLeavesSpanUnmarked() {
        RequestContext context = context("POST", "/api/v1/auth/login");
        requestTracer.openRequestSpan(new MockHttpServletRequest("POST", "/api/v1/auth/login"), context);
        SimpleSpan span = (SimpleSpan) context.span().orElseThrow();

        requestTracer.closeRequestSpan(context, "/api/v1/auth/login", 401, RequestOutcome.OK,
                new IllegalArgumentException("bad credentials"));

        assertNull(span.getError());
    }

    @Test
    void childSpanNestsUnderRequestSpanAndRethrows() {
        RequestContext context = context("POST", "/api/v1/tasks");
        requestTracer.openRequestSpan(new MockHttpServletRequest("POST", "/api/v1/tasks"), context);
        SimpleSpan parent = (SimpleSpan) context.span().orElseThrow();

        String result = requestTracer.inChildSpan(context, "task_creation", () -> {
            Span current = tracer.currentSpan();
            assertNotNull(current);
            assertNotSame(parent, current);
            assertEquals("task_creation", ((SimpleSpan) current).getTags().get("function.name"));
            return "done";
        });
        assertEquals("done", result);

        RuntimeException failure = new RuntimeException("insert failed");
        RuntimeException thrown = assertThrows(RuntimeException.class,
                () -> requestTracer.inChildSpan(context, "task_creation", () -> { throw failure; }));
        assertSame(failure, thrown);
    }

    @Test
    void continuesInboundTraceContext() {
        Propagator propagator = mock(Propagator.class);
        when(propagator.fields()).thenReturn(List.of("traceparent"));
        Span.Builder builder = tracer.spanBuilder();
        when(propagator.extract(any(), any())).thenReturn(builder);
        RequestTracer continuing = new RequestTracer(tracer, propagator, true);

        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/tasks");
        request.addHeader("traceparent", "00-0af7651916cd43dd8448eb211c80319c-b7ad6b7169203331-01");
        RequestContext context = context("GET", "/api/v1/tasks");

        continuing.openRequestSpan(request, context);

        verify(propagator).extract(eq(request), any());
        assertTrue(context.span().isPresent());
    }

    @Test
    void disabledTracingCreatesNoSpans() {
        RequestTracer disabled = new RequestTracer(tracer, Propagator.NOOP, false);
        RequestContext context = context("GET", "/");

        disabled.openRequestSpan(new MockHttpServletRequest("GET", "/"), context);

        assertTrue(context.span().isEmpty());
        assertSame(RequestTracer.NO_SCOPE, disabled.scope(context));
        assertEquals(3, disabled.inChildSpan(context, "noop", () -> 3));
        assertNull(disabled.traceId(context));
    }
}
