package com.sectune.dispatch.api;

import com.sectune.core.health.HealthCheckService;
import com.sectune.core.health.HealthStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller for system health status.
 */
@RestController
@RequestMapping("/api/v1/health")
public class HealthController {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    private final HealthCheckService healthCheckService;

    public HealthController(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    /**
     * GET /api/v1/health: 503 when any component is DOWN. A DEGRADED component
     * (in-memory store, missing API key) reports overall DEGRADED with 200.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> result = new LinkedHashMap<>();

        if (healthCheckService == null) {
            result.put("status", "DOWN");
            result.put("components", Map.of());
            return ResponseEntity.status(503).body(result);
        }

        var checks = healthCheckService.checkAll();
        var overall = HealthStatus.overall(checks);

        Map<String, Object> components = new LinkedHashMap<>();
        for (var check : checks) {
            Map<String, String> componentInfo = new LinkedHashMap<>();
            componentInfo.put("status", check.status().name());
            componentInfo.put("detail", check.detail());

            if (!check.metadata().isEmpty()) {
                componentInfo.putAll(check.metadata());
            }
            components.put(check.component(), componentInfo);
        }

        result.put("status", overall.name());
        result.put("components", components);

        if (overall == HealthStatus.Status.DOWN) {
            log.warn("Health check reports DOWN: {}", components.keySet());
            return ResponseEntity.status(503).body(result);
        }
        return ResponseEntity.ok(result);
    }
}
