package com.tasklens.config;

import com.tasklens.observability.TasklensMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics wiring. The Prometheus registry is built here rather than left to actuator
 * auto-configuration so that {@code /metrics} scrapes the same instance in every
 * environment, tests included.
 */
@Configuration
public class MetricsConfig {

    private static final Logger log = LoggerFactory.getLogger(MetricsConfig.class);

    @Bean
    public PrometheusMeterRegistry prometheusMeterRegistry() {
        return new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
    }

    @Bean
    public TasklensMetrics tasklensMetrics(MeterRegistry registry, TasklensProperties properties) {
        boolean enabled = properties.getObservability().isMetricsEnabled();
        log.atInfo().setMessage("Metrics collector initialized").addKeyValue("enabled", enabled).log();
        return new TasklensMetrics(registry, enabled);
    }

    /**
     * Service identity on every series, for filtering in Prometheus and Grafana.
     */
    @Bean
    MeterRegistryCustomizer<MeterRegistry> metricsCommonTags(TasklensProperties properties) {
        return registry -> registry.config().commonTags(
                "service", properties.getService().getName(),
                "environment", properties.getService().getEnvironment());
    }

    /**
     * Caps distinct {@code endpoint} values per request meter. Route templates keep the label
     * bounded already; this guards against unmatched paths falling through as raw URIs.
     */
    @Bean
    public MeterFilter endpointCardinalityLimit(TasklensProperties properties) {
        int max = properties.getObservability().getMaxEndpointTags();
        return MeterFilter.maximumAllowableTags("http.", "endpoint", max, MeterFilter.deny());
    }
}
