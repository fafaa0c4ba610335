package com.tasklens.observability;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.tracing.propagation.Propagator;
import io.micrometer.tracing.test.simple.SimpleTracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OperationInterceptorTest {

    private SimpleMeterRegistry registry;
    private OperationInterceptor operations;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        operations = new OperationInterceptor(
                new RequestTracer(new SimpleTracer(), Propagator.NOOP, true),
                new TasklensMetrics(registry, true));
    }

    @Test
    void timesSuccessfulOperation() {
        String result = operations.call(RequestContext.detached("req-1"), "task_creation", () -> "created");

        assertEquals("created", result);
        assertEquals(1, registry.get(TasklensMetrics.TASK_DURATION).tag("task_name", "task_creation").timer().count());
    }

    @Test
    void timesFailedOperationAndRethrows() {
        IllegalArgumentException failure = new IllegalArgumentException("duplicate");

        IllegalArgumentException thrown = assertThrows(IllegalArgumentException.class,
                () -> operations.call(RequestContext.detached("req-2"), "user_registration", () -> {
                    throw failure;
                }));

        assertSame(failure, thrown);
        assertEquals(1, registry.get(TasklensMetrics.TASK_DURATION).tag("task_name", "user_registration").timer().count());
    }

    @Test
    void runAcceptsVoidWork() {
        int[] calls = {0};
        operations.run(RequestContext.detached("req-3"), "task_delete", () -> calls[0]++);

        assertEquals(1, calls[0]);
        assertEquals(1, registry.get(TasklensMetrics.TASK_DURATION).tag("task_name", "task_delete").timer().count());
    }
}
