package com.tasklens.config;

import com.tasklens.observability.RequestTracer;
import io.micrometer.observation.ObservationPredicate;
import io.micrometer.tracing.Tracer;
import io.micrometer.tracing.propagation.Propagator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.server.observation.ServerRequestObservationContext;

/**
 * Request tracing wiring. The OpenTelemetry bridge and OTLP exporter are configured by
 * Spring Boot from {@code management.tracing.*} and {@code management.otlp.tracing.*};
 * this class only decides whether request spans are opened and who opens them.
 */
@Configuration
public class TracingConfig {

    private static final Logger log = LoggerFactory.getLogger(TracingConfig.class);

    @Bean
    public RequestTracer requestTracer(ObjectProvider<Tracer> tracer,
                                       ObjectProvider<Propagator> propagator,
                                       TasklensProperties properties) {
        boolean enabled = properties.getObservability().isTracingEnabled();
        log.atInfo()
                .setMessage("Tracing configured")
                .addKeyValue("enabled", enabled)
                .addKeyValue("collector", properties.getObservability().getTraceCollectorEndpoint())
                .log();
        return new RequestTracer(
                tracer.getIfAvailable(() -> Tracer.NOOP),
                propagator.getIfAvailable(() -> Propagator.NOOP),
                enabled);
    }

    /**
     * Server spans are opened by the request filter. Spring MVC's own server observation
     * would create a second span per request, so it is switched off.
     */
    @Bean
    public ObservationPredicate skipServerRequestObservations() {
        return (name, context) -> !(context instanceof ServerRequestObservationContext);
    }
}
