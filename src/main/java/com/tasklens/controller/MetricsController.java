package com.tasklens.controller;

import com.tasklens.exception.ApiException;
import com.tasklens.observability.TasklensMetrics;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Prometheus scrape endpoint.
 */
@RestController
public class MetricsController {

    static final MediaType PROMETHEUS_TEXT = MediaType.parseMediaType("text/plain; version=0.0.4; charset=utf-8");

    private final TasklensMetrics metrics;

    public MetricsController(TasklensMetrics metrics) {
        this.metrics = metrics;
    }

    @GetMapping("/metrics")
    public ResponseEntity<String> scrape() {
        if (!metrics.isEnabled()) {
            throw ApiException.notFound("METRICS_DISABLED", "Metrics not enabled");
        }
        return ResponseEntity.ok()
                .contentType(PROMETHEUS_TEXT)
                .body(metrics.exportText());
    }
}
