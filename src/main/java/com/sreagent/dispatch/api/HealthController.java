package com.sreagent.dispatch.api;

import com.sreagent.core.health.HealthCheckService;
import com.sreagent.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for orchestrator dependency health.
 */
@RestController
@RequestMapping("/api/v1/health")
public class HealthController {

    private final HealthCheckService healthCheckService;

    public HealthController(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    /**
     * GET /api/v1/health: tool server, LLM and registry status.
     * 503 when any component is DOWN; DEGRADED still answers 200.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        List<HealthStatus> checks = healthCheckService != null ? healthCheckService.checkAll() : List.of();
        boolean down = healthCheckService == null || checks.stream().anyMatch(HealthStatus::isDown);

        Map<String, Object> components = new LinkedHashMap<>();
        checks.forEach(check -> components.put(check.component(), describe(check)));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", down ? "DOWN" : "UP");
        body.put("components", components);
        return ResponseEntity.status(down ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK).body(body);
    }

    private static Map<String, Object> describe(HealthStatus check) {
        Map<String, Object> component = new LinkedHashMap<>();
        component.put("status", check.status().name());
        component.put("detail", check.detail());
        if (!check.metadata().isEmpty()) {
            component.put("metadata", check.metadata());
        }
        return component;
    }
}
