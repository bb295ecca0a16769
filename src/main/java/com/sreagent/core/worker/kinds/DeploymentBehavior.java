package com.sreagent.core.worker.kinds;

import com.sreagent.core.events.EventPhase;
import com.sreagent.core.worker.WorkerBehavior;
import com.sreagent.core.worker.WorkerContext;

import java.util.List;
import java.util.Map;

/**
 * Application lifecycle: deployment history, status, and restart/stop/start.
 */
public class DeploymentBehavior implements WorkerBehavior {

    private static final List<String> ACTIONS = List.of(
            "get_deployment_history", "get_app_status", "restart_app", "stop_app", "start_app");

    @Override
    public Map<String, Object> execute(String action, Map<String, Object> params, WorkerContext context) {
        return switch (action) {
            case "get_deployment_history" -> {
                context.emit("Fetching deployment history", EventPhase.RUNNING);
                yield context.tools().invoke("get_deployment_history", Map.of());
            }
            case "get_app_status" -> {
                context.emit("Checking app status", EventPhase.RUNNING);
                yield context.tools().invoke("get_app_status", Map.of());
            }
            case "restart_app" -> {
                context.emit("Restarting application", EventPhase.RUNNING, "Scale 0 then scale 1");
                Map<String, Object> result = context.tools().invoke("restart_app", Map.of());
                context.emit("Restart initiated", EventPhase.COMPLETED);
                yield result;
            }
            case "stop_app" -> {
                context.emit("Stopping application", EventPhase.RUNNING);
                yield context.tools().invoke("stop_app", Map.of());
            }
            case "start_app" -> {
                context.emit("Starting application", EventPhase.RUNNING);
                yield context.tools().invoke("start_app", Map.of());
            }
            default -> {
                context.emit("Default: fetching app status", EventPhase.RUNNING);
                yield context.tools().invoke("get_app_status", Map.of());
            }
        };
    }

    @Override
    public List<String> supportedActions() {
        return ACTIONS;
    }

    @Override
    public String defaultAction() {
        return "get_app_status";
    }
}
