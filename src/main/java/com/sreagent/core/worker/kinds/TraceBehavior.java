package com.sreagent.core.worker.kinds;

import com.sreagent.core.events.EventPhase;
import com.sreagent.core.worker.WorkerBehavior;
import com.sreagent.core.worker.WorkerContext;

import java.util.List;
import java.util.Map;

import static com.sreagent.core.worker.WorkerParams.intParam;
import static com.sreagent.core.worker.WorkerParams.stringParam;

/**
 * Distributed trace analysis.
 */
public class TraceBehavior implements WorkerBehavior {

    private static final List<String> ACTIONS = List.of(
            "get_recent_traces", "get_trace_details", "get_trace_summary");

    @Override
    public Map<String, Object> execute(String action, Map<String, Object> params, WorkerContext context) {
        Map<String, Object> result = switch (action) {
            case "get_recent_traces" -> {
                int limit = intParam(params, "limit", 20);
                context.emit("Fetching recent traces", EventPhase.RUNNING, "Limit: " + limit);
                yield context.tools().invoke("get_recent_traces", Map.of("limit", limit));
            }
            case "get_trace_details" -> {
                String traceId = stringParam(params, "trace_id", null);
                if (traceId == null) {
                    throw new IllegalArgumentException("trace_id is required");
                }
                String shortId = traceId.length() > 16 ? traceId.substring(0, 16) + "..." : traceId;
                context.emit("Fetching trace details", EventPhase.RUNNING, "Trace: " + shortId);
                yield context.tools().invoke("get_trace_details", Map.of("trace_id", traceId));
            }
            case "get_trace_summary" -> {
                int hours = intParam(params, "hours", 1);
                context.emit("Generating trace summary, last " + hours + "h", EventPhase.RUNNING);
                yield context.tools().invoke("get_trace_summary", Map.of("hours", hours));
            }
            default -> {
                context.emit("Default: fetching recent traces", EventPhase.RUNNING);
                yield context.tools().invoke("get_recent_traces", Map.of("limit", 20));
            }
        };

        Object traces = result.get("traces");
        int count = traces instanceof List<?> list ? list.size() : 0;
        context.emit("Retrieved " + count + " traces", EventPhase.COMPLETED);
        return result;
    }

    @Override
    public List<String> supportedActions() {
        return ACTIONS;
    }

    @Override
    public String defaultAction() {
        return "get_recent_traces";
    }
}
