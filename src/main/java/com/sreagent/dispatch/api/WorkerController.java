package com.sreagent.dispatch.api;

import com.sreagent.core.model.RegistryStats;
import com.sreagent.core.model.WorkerRecord;
import com.sreagent.core.registry.LifecycleRegistry;
import com.sreagent.core.worker.WorkerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for inspecting workers: the kind catalog, live and completed workers,
 * and lifecycle stats.
 */
@RestController
@RequestMapping("/api/v1/workers")
public class WorkerController {

    private final LifecycleRegistry registry;
    private final WorkerFactory workerFactory;

    public WorkerController(LifecycleRegistry registry, WorkerFactory workerFactory) {
        this.registry = registry;
        this.workerFactory = workerFactory;
    }

    @GetMapping
    public Map<String, Object> catalog() {
        return Map.of("agents", workerFactory.catalog());
    }

    /**
     * GET /api/v1/workers/active: Workers currently executing or in cooldown.
     */
    @GetMapping("/active")
    public Map<String, Object> active() {
        List<WorkerRecord> active = registry.getActive();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("active_agents", active);
        body.put("count", active.size());
        return body;
    }

    /**
     * GET /api/v1/workers/completed: Destroyed workers with their full audit trail,
     * most recent first.
     */
    @GetMapping("/completed")
    public Map<String, Object> completed(@RequestParam(defaultValue = "50") int limit) {
        List<WorkerRecord> completed = registry.getCompleted(limit);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("completed_agents", completed);
        body.put("count", completed.size());
        return body;
    }

    @GetMapping("/stats")
    public RegistryStats stats() {
        return registry.getStats();
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> worker(@PathVariable String id) {
        return registry.getById(id)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(Map.of("error", "Worker " + id + " not found")));
    }
}
