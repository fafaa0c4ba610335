package com.tasklens.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "tasklens")
public class TasklensProperties {

    private ServiceProperties service = new ServiceProperties();
    private ObservabilityProperties observability = new ObservabilityProperties();
    private LoggingProperties logging = new LoggingProperties();
    private SecurityProperties security = new SecurityProperties();

    public ServiceProperties getService() { return service; }
    public void setService(ServiceProperties service) { this.service = service; }

    public ObservabilityProperties getObservability() { return observability; }
    public void setObservability(ObservabilityProperties observability) { this.observability = observability; }

    public LoggingProperties getLogging() { return logging; }
    public void setLogging(LoggingProperties logging) { this.logging = logging; }

    public SecurityProperties getSecurity() { return security; }
    public void setSecurity(SecurityProperties security) { this.security = security; }

    /**
     * Static service identity. Used only to enrich logs, traces and the info endpoints.
     */
    public static class ServiceProperties {
        private String name = "tasklens";
        private String version = "1.0.0";
        private String environment = "production";

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getVersion() { return version; }
        public void setVersion(String version) { this.version = version; }
        public String getEnvironment() { return environment; }
        public void setEnvironment(String environment) { this.environment = environment; }

        public boolean isProduction() {
            return "production".equalsIgnoreCase(environment);
        }
    }

    public static class ObservabilityProperties {
        private boolean metricsEnabled = true;
        private boolean tracingEnabled = true;
        private String traceCollectorEndpoint = "http://localhost:4318/v1/traces";
        private int maxEndpointTags = 100;
        private List<String> metricsExcludedPaths = new ArrayList<>(List.of("/metrics"));

        public boolean isMetricsEnabled() { return metricsEnabled; }
        public void setMetricsEnabled(boolean metricsEnabled) { this.metricsEnabled = metricsEnabled; }
        public boolean isTracingEnabled() { return tracingEnabled; }
        public void setTracingEnabled(boolean tracingEnabled) { this.tracingEnabled = tracingEnabled; }
        public String getTraceCollectorEndpoint() { return traceCollectorEndpoint; }
        public void setTraceCollectorEndpoint(String endpoint) { this.traceCollectorEndpoint = endpoint; }
        public int getMaxEndpointTags() { return maxEndpointTags; }
        public void setMaxEndpointTags(int maxEndpointTags) { this.maxEndpointTags = maxEndpointTags; }
        public List<String> getMetricsExcludedPaths() { return metricsExcludedPaths; }
        public void setMetricsExcludedPaths(List<String> paths) { this.metricsExcludedPaths = paths; }
    }

    public static class LoggingProperties {
        private String level = "INFO";
        private String format = "json";

        public String getLevel() { return level; }
        public void setLevel(String level) { this.level = level; }
        public String getFormat() { return format; }
        public void setFormat(String format) { this.format = format; }
    }

    public static class SecurityProperties {
        private String jwtSecret = "your-super-secret-key-change-in-production";
        private int accessTokenExpireMinutes = 30;

        public String getJwtSecret() { return jwtSecret; }
        public void setJwtSecret(String jwtSecret) { this.jwtSecret = jwtSecret; }
        public int getAccessTokenExpireMinutes() { return accessTokenExpireMinutes; }
        public void setAccessTokenExpireMinutes(int minutes) { this.accessTokenExpireMinutes = minutes; }
    }
}
