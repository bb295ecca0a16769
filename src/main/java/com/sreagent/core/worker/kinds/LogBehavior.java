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
 * Log analysis: error, recent, application and platform logs, plus free-form queries.
 */
public class LogBehavior implements WorkerBehavior {

    private static final List<String> ACTIONS = List.of(
            "get_error_logs", "get_recent_logs", "get_app_logs", "get_platform_logs", "query_logs");

    @Override
    public Map<String, Object> execute(String action, Map<String, Object> params, WorkerContext context) {
        context.emit("Fetching logs", EventPhase.RUNNING, "Action: " + action + ", Params: " + params);

        Map<String, Object> result = switch (action) {
            case "get_error_logs" -> {
                int hours = intParam(params, "hours", 24);
                int limit = intParam(params, "limit", 100);
                context.emit("Scanning error logs, last " + hours + "h", EventPhase.RUNNING, "Limit: " + limit);
                yield context.tools().invoke("get_error_logs", window(hours, limit));
            }
            case "get_recent_logs" -> {
                int limit = intParam(params, "limit", 50);
                context.emit("Fetching recent logs", EventPhase.RUNNING, "Limit: " + limit);
                yield context.tools().invoke("get_recent_logs", Map.of("limit", limit));
            }
            case "get_app_logs" -> {
                int hours = intParam(params, "hours", 1);
                context.emit("Fetching app logs, last " + hours + "h", EventPhase.RUNNING);
                yield context.tools().invoke("get_app_logs", window(hours, intParam(params, "limit", 50)));
            }
            case "get_platform_logs" -> {
                int hours = intParam(params, "hours", 1);
                context.emit("Fetching platform logs, last " + hours + "h", EventPhase.RUNNING);
                yield context.tools().invoke("get_platform_logs", window(hours, intParam(params, "limit", 50)));
            }
            case "query_logs" -> {
                String query = stringParam(params, "query", "source logs");
                context.emit("Custom log query", EventPhase.RUNNING, "Query: " + query);
                Map<String, Object> args = new LinkedHashMap<>();
                args.put("query", query);
                args.putAll(window(intParam(params, "hours", 1), intParam(params, "limit", 50)));
                yield context.tools().invoke("query_logs", args);
            }
            default -> {
                context.emit("Default: fetching error logs, last 24h", EventPhase.RUNNING);
                yield context.tools().invoke("get_error_logs", window(24, 100));
            }
        };

        Object logs = result.get("logs");
        String detail = logs instanceof List<?> entries ? "Found " + entries.size() + " log entries" : "";
        context.emit("Log data retrieved", EventPhase.COMPLETED, detail);
        return result;
    }

    @Override
    public List<String> supportedActions() {
        return ACTIONS;
    }

    @Override
    public String defaultAction() {
        return "get_error_logs";
    }

    private static Map<String, Object> window(int hours, int limit) {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("hours", hours);
        args.put("limit", limit);
        return args;
    }
}
