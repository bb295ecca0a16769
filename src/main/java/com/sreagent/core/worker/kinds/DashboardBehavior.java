package com.sreagent.core.worker.kinds;

import com.sreagent.core.events.EventPhase;
import com.sreagent.core.worker.WorkerBehavior;
import com.sreagent.core.worker.WorkerContext;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.sreagent.core.worker.WorkerParams.intParam;

/**
 * SRE dashboard built from the four golden signals: latency, traffic, errors and
 * saturation.
 */
public class DashboardBehavior implements WorkerBehavior {

    private static final List<String> ACTIONS = List.of(
            "get_dashboard", "get_response_times", "get_failure_analysis");

    @Override
    public Map<String, Object> execute(String action, Map<String, Object> params, WorkerContext context) {
        return switch (action) {
            case "get_dashboard" -> goldenSignals(params, context);
            case "get_response_times" -> {
                int hours = intParam(params, "hours", 1);
                context.emit("Fetching response time metrics, last " + hours + "h", EventPhase.RUNNING);
                yield context.tools().invoke("get_response_times", Map.of("hours", hours));
            }
            case "get_failure_analysis" -> {
                int hours = intParam(params, "hours", 24);
                context.emit("Analyzing failures, last " + hours + "h", EventPhase.RUNNING);
                yield context.tools().invoke("get_failure_analysis", Map.of("hours", hours));
            }
            default -> {
                context.emit("Default: building full SRE dashboard", EventPhase.RUNNING);
                yield context.tools().invoke("get_sre_dashboard", Map.of());
            }
        };
    }

    private Map<String, Object> goldenSignals(Map<String, Object> params, WorkerContext context) {
        context.emit("Building SRE Dashboard", EventPhase.RUNNING, "Collecting Golden Signals");

        context.emit("Latency: fetching response times", EventPhase.RUNNING);
        Map<String, Object> responseTimes = context.tools().invoke("get_response_times",
                Map.of("hours", intParam(params, "hours", 1)));

        context.emit("Traffic: checking system status", EventPhase.RUNNING);
        Map<String, Object> systemStatus = context.tools().invoke("get_system_status", Map.of());

        context.emit("Errors: analyzing failures", EventPhase.RUNNING);
        Map<String, Object> failures = context.tools().invoke("get_failure_analysis",
                Map.of("hours", intParam(params, "hours", 24)));

        context.emit("Saturation: fetching SRE dashboard", EventPhase.RUNNING);
        Map<String, Object> dashboard = context.tools().invoke("get_sre_dashboard", Map.of());

        context.emit("Assembling dashboard", EventPhase.COMPLETED);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("dashboard", dashboard);
        result.put("response_times", responseTimes);
        result.put("system_status", systemStatus);
        result.put("failure_analysis", failures);
        return result;
    }

    @Override
    public List<String> supportedActions() {
        return ACTIONS;
    }

    @Override
    public String defaultAction() {
        return "get_sre_dashboard";
    }
}
