package com.tasklens.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import org.slf4j.spi.LoggingEventBuilder;

/**
 * Structured event logger. Each call emits exactly one SLF4J event whose message is the
 * event name and whose details travel as key-value pairs, so both the ECS JSON renderer and
 * the plain console pattern carry the same content.
 * <p>
 * The correlation id comes from the {@link RequestContext} passed in, and is attached to this
 * one event only. Disabled levels return before any pair is built.
 */
public final class EventLog {

    public static final String REQUEST_ID_KEY = "request_id";
    public static final String USER_ID_KEY = "user_id";

    private final Logger logger;

    private EventLog(Logger logger) {
        this.logger = logger;
    }

    public static EventLog getLogger(Class<?> type) {
        return new EventLog(LoggerFactory.getLogger(type));
    }

    public static EventLog of(Logger logger) {
        return new EventLog(logger);
    }

    public boolean isEnabled(Level level) {
        return logger.isEnabledForLevel(level);
    }

    public void debug(RequestContext context, String event, Object... keyValues) {
        log(Level.DEBUG, context, event, null, keyValues);
    }

    public void info(RequestContext context, String event, Object... keyValues) {
        log(Level.INFO, context, event, null, keyValues);
    }

    public void warn(RequestContext context, String event, Object... keyValues) {
        log(Level.WARN, context, event, null, keyValues);
    }

    public void error(RequestContext context, String event, Throwable cause, Object... keyValues) {
        log(Level.ERROR, context, event, cause, keyValues);
    }

    public void log(Level level, RequestContext context, String event, Throwable cause, Object... keyValues) {
        if (!logger.isEnabledForLevel(level)) {
            return;
        }
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Key-value pairs must come in twos for event '" + event + "'");
        }
        LoggingEventBuilder builder = logger.atLevel(level).setMessage(event);
        if (context != null) {
            builder.addKeyValue(REQUEST_ID_KEY, context.correlationId());
            context.userId().ifPresent(id -> builder.addKeyValue(USER_ID_KEY, id));
        }
        for (int i = 0; i < keyValues.length; i += 2) {
            builder.addKeyValue(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        if (cause != null) {
            builder.setCause(cause);
        }
        builder.log();
    }
}
