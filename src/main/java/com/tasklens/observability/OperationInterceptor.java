package com.tasklens.observability;

import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Wraps a named unit of work with a child span, a {@code task.duration} sample and a
 * debug event. The duration is recorded whether the work returns or throws, and the
 * original failure is rethrown unchanged.
 */
@Component
public class OperationInterceptor {

    private static final EventLog events = EventLog.getLogger(OperationInterceptor.class);

    private final RequestTracer requestTracer;
    private final TasklensMetrics metrics;

    public OperationInterceptor(RequestTracer requestTracer, TasklensMetrics metrics) {
        this.requestTracer = requestTracer;
        this.metrics = metrics;
    }

    public <T> T call(RequestContext context, String operation, Supplier<T> work) {
        long start = System.nanoTime();
        boolean failed = true;
        try {
            T result = requestTracer.inChildSpan(context, operation, work);
            failed = false;
            return result;
        } finally {
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            metrics.recordTaskDuration(operation, elapsed);
            events.debug(context, "Operation finished",
                    "operation", operation,
                    "duration_ms", elapsed.toNanos() / 1_000_000.0,
                    "failed", failed);
        }
    }

    public void run(RequestContext context, String operation, Runnable work) {
        call(context, operation, () -> {
            work.run();
            return null;
        });
    }
}
