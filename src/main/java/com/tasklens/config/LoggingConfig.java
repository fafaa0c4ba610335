package com.tasklens.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Applies environment-dependent logger levels once the context is up.
 * Production keeps SQL and web access loggers quiet; every other environment runs them at INFO.
 * Renderer selection happens earlier, in {@link LogFormatEnvironmentPostProcessor}.
 */
@Configuration
public class LoggingConfig {

    private static final Logger log = LoggerFactory.getLogger(LoggingConfig.class);

    static final List<String> NOISY_LOGGERS = List.of(
            "org.hibernate.SQL",
            "org.springframework.web.servlet.DispatcherServlet");

    private final TasklensProperties properties;
    private final LoggingSystem loggingSystem;

    public LoggingConfig(TasklensProperties properties, LoggingSystem loggingSystem) {
        this.properties = properties;
        this.loggingSystem = loggingSystem;
    }

    @PostConstruct
    public void configureLoggerLevels() {
        LogLevel noisyLevel = properties.getService().isProduction() ? LogLevel.WARN : LogLevel.INFO;
        for (String name : NOISY_LOGGERS) {
            loggingSystem.setLogLevel(name, noisyLevel);
        }
        log.atInfo()
                .setMessage("Logging configured")
                .addKeyValue("format", properties.getLogging().getFormat())
                .addKeyValue("level", properties.getLogging().getLevel())
                .addKeyValue("environment", properties.getService().getEnvironment())
                .log();
    }
}
