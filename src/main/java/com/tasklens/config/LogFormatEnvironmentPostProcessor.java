package com.tasklens.config;

import org.apache.commons.logging.Log;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.boot.logging.DeferredLogFactory;
import org.springframework.core.Ordered;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;

import java.util.Locale;
import java.util.Map;

/**
 * Translates {@code tasklens.logging.format} into Spring Boot's console renderer selection.
 * Runs after config data is loaded and before the logging system is initialized, so exactly
 * one renderer is ever installed: ECS JSON for {@code json}, the plain console pattern for
 * {@code plain}.
 */
public class LogFormatEnvironmentPostProcessor implements EnvironmentPostProcessor, Ordered {

    static final String FORMAT_PROPERTY = "tasklens.logging.format";
    static final String STRUCTURED_CONSOLE_PROPERTY = "logging.structured.format.console";
    static final String PROPERTY_SOURCE_NAME = "tasklensLogFormat";

    private final Log log;

    public LogFormatEnvironmentPostProcessor(DeferredLogFactory logFactory) {
        this.log = logFactory.getLog(LogFormatEnvironmentPostProcessor.class);
    }

    @Override
    public void postProcessEnvironment(ConfigurableEnvironment environment, SpringApplication application) {
        String format = environment.getProperty(FORMAT_PROPERTY, "json").trim().toLowerCase(Locale.ROOT);
        String renderer = switch (format) {
            case "json" -> "ecs";
            case "plain" -> "";
            default -> {
                log.warn("Unknown " + FORMAT_PROPERTY + " '" + format + "', falling back to json");
                yield "ecs";
            }
        };
        environment.getPropertySources().addFirst(
                new MapPropertySource(PROPERTY_SOURCE_NAME, Map.of(STRUCTURED_CONSOLE_PROPERTY, renderer)));
    }

    @Override
    public int getOrder() {
        return Ordered.LOWEST_PRECEDENCE;
    }
}
