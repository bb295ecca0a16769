package com.sreagent.core.worker.kinds;

import com.sreagent.core.events.EventPhase;
import com.sreagent.core.worker.WorkerBehavior;
import com.sreagent.core.worker.WorkerContext;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.sreagent.core.worker.WorkerParams.intParam;
import static com.sreagent.core.worker.WorkerParams.stringParam;

/**
 * Start/stop/status control of a background watch running on the tool server.
 * Subclasses name the tools and the default check interval.
 */
abstract class WatchControlBehavior implements WorkerBehavior {

    private static final List<String> ACTIONS = List.of("start", "stop", "status");

    private final String subject;
    private final String startTool;
    private final String stopTool;
    private final String statusTool;
    private final int defaultIntervalMinutes;

    WatchControlBehavior(String subject, String startTool, String stopTool, String statusTool,
                         int defaultIntervalMinutes) {
        this.subject = subject;
        this.startTool = startTool;
        this.stopTool = stopTool;
        this.statusTool = statusTool;
        this.defaultIntervalMinutes = defaultIntervalMinutes;
    }

    @Override
    public Map<String, Object> execute(String action, Map<String, Object> params, WorkerContext context) {
        return switch (action) {
            case "start" -> {
                int interval = intParam(params, "interval_minutes", defaultIntervalMinutes);
                beforeStart(interval, context);
                Map<String, Object> args = new LinkedHashMap<>();
                args.put("interval_minutes", interval);
                args.put("teams_webhook_url", stringParam(params, "webhook_url", ""));
                Map<String, Object> result = context.tools().invoke(startTool, args);
                afterStart(context);
                yield result;
            }
            case "stop" -> {
                context.emit("Stopping " + subject, EventPhase.RUNNING);
                Map<String, Object> result = context.tools().invoke(stopTool, Map.of());
                context.emit(capitalized() + " deactivated", EventPhase.COMPLETED);
                yield result;
            }
            case "status" -> {
                context.emit("Checking " + subject + " status", EventPhase.RUNNING);
                Map<String, Object> result = context.tools().invoke(statusTool, Map.of());
                context.emit(capitalized() + " is " + (isActive(result) ? "ACTIVE" : "INACTIVE"),
                        EventPhase.COMPLETED);
                yield result;
            }
            default -> {
                context.emit("Fetching " + subject + " status", EventPhase.RUNNING);
                yield context.tools().invoke(statusTool, Map.of());
            }
        };
    }

    protected abstract void beforeStart(int intervalMinutes, WorkerContext context);

    protected abstract void afterStart(WorkerContext context);

    static boolean isActive(Map<String, Object> status) {
        Object active = status.containsKey("active") ? status.get("active") : status.get("monitoring_active");
        return Boolean.TRUE.equals(active) || "true".equalsIgnoreCase(String.valueOf(active));
    }

    private String capitalized() {
        return Character.toUpperCase(subject.charAt(0)) + subject.substring(1);
    }

    @Override
    public List<String> supportedActions() {
        return ACTIONS;
    }

    @Override
    public String defaultAction() {
        return "status";
    }
}
