package com.sreagent.core.worker.kinds;

import com.sreagent.core.events.EventPhase;
import com.sreagent.core.worker.WorkerBehavior;
import com.sreagent.core.worker.WorkerContext;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Health checks against the application, its database, and the overall system.
 * {@code check_all} runs the three checks in sequence and combines them.
 */
public class HealthBehavior implements WorkerBehavior {

    private static final List<String> ACTIONS = List.of(
            "check_app_health", "check_database_health", "get_system_status", "check_all");

    @Override
    public Map<String, Object> execute(String action, Map<String, Object> params, WorkerContext context) {
        Map<String, Object> result = switch (action) {
            case "check_app_health" -> {
                context.emit("Checking application health", EventPhase.RUNNING, "HTTP GET to app endpoint");
                yield context.tools().invoke("check_app_health", Map.of());
            }
            case "check_database_health" -> {
                context.emit("Checking database health", EventPhase.RUNNING, "Database connection test");
                yield context.tools().invoke("check_database_health", Map.of());
            }
            case "get_system_status" -> {
                context.emit("Fetching full system status", EventPhase.RUNNING, "App + DB + Error scan");
                yield context.tools().invoke("get_system_status", Map.of());
            }
            case "check_all" -> checkAll(context);
            default -> {
                context.emit("Default: full system status", EventPhase.RUNNING);
                yield context.tools().invoke("get_system_status", Map.of());
            }
        };

        boolean healthy = result.get("error") == null;
        context.emit("Health check result: " + (healthy ? "HEALTHY" : "ERROR"), EventPhase.COMPLETED);
        return result;
    }

    private Map<String, Object> checkAll(WorkerContext context) {
        context.emit("Checking application health", EventPhase.RUNNING);
        Map<String, Object> appHealth = context.tools().invoke("check_app_health", Map.of());

        context.emit("Checking database health", EventPhase.RUNNING);
        Map<String, Object> databaseHealth = context.tools().invoke("check_database_health", Map.of());

        context.emit("Fetching system status", EventPhase.RUNNING);
        Map<String, Object> systemStatus = context.tools().invoke("get_system_status", Map.of());

        Map<String, Object> combined = new LinkedHashMap<>();
        combined.put("app_health", appHealth);
        combined.put("database_health", databaseHealth);
        combined.put("system_status", systemStatus);
        return combined;
    }

    @Override
    public List<String> supportedActions() {
        return ACTIONS;
    }

    @Override
    public String defaultAction() {
        return "get_system_status";
    }
}
