package com.tasklens.controller;

import com.tasklens.config.TasklensProperties;
import com.tasklens.observability.EventLog;
import com.tasklens.observability.RequestContext;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

/**
 * Service info, liveness and readiness probes, and the database-backed health check.
 */
@RestController
public class ProbeController {

    private static final EventLog events = EventLog.getLogger(ProbeController.class);

    private final TasklensProperties properties;
    private final JdbcTemplate jdbcTemplate;

    public ProbeController(TasklensProperties properties, JdbcTemplate jdbcTemplate) {
        this.properties = properties;
        this.jdbcTemplate = jdbcTemplate;
    }

    @GetMapping("/")
    public ServiceInfo root() {
        TasklensProperties.ServiceProperties service = properties.getService();
        return new ServiceInfo("Tasklens task service", service.getVersion(), service.getEnvironment(), "running");
    }

    @GetMapping("/live")
    public ProbeStatus live() {
        return new ProbeStatus("alive", epochSeconds());
    }

    @GetMapping("/ready")
    public ProbeStatus ready() {
        return new ProbeStatus("ready", epochSeconds());
    }

    @GetMapping("/api/v1/health")
    public ResponseEntity<HealthStatus> health(RequestContext context) {
        TasklensProperties.ServiceProperties service = properties.getService();
        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
        } catch (DataAccessException e) {
            context.recordFailure(e);
            events.error(context, "Health check failed", e, "error", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(new HealthStatus(
                    "unhealthy", Instant.now(), service.getVersion(), service.getEnvironment(), "unhealthy"));
        }
        events.debug(context, "Health check successful");
        return ResponseEntity.ok(new HealthStatus(
                "healthy", Instant.now(), service.getVersion(), service.getEnvironment(), "healthy"));
    }

    private static double epochSeconds() {
        return System.currentTimeMillis() / 1000.0;
    }

    public record ServiceInfo(String message, String version, String environment, String status) {}

    public record ProbeStatus(String status, double timestamp) {}

    public record HealthStatus(String status, Instant timestamp, String version, String environment,
                               String database) {}
}
