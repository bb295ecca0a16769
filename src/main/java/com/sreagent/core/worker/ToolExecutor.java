package com.sreagent.core.worker;

import java.util.Map;

/**
 * Performs a named operational tool call (log queries, health checks, app restarts...)
 * on behalf of a worker.
 * <p>
 * Implementations may block for an arbitrary time; each worker calls its executor on
 * its own thread.
 */
public interface ToolExecutor {

    /**
     * Invokes a tool.
     *
     * @param toolName the tool to invoke, e.g. {@code get_error_logs}
     * @param args     tool arguments, never null
     * @return the tool's result as a JSON-like map
     * @throws ToolExecutionException when the tool cannot be reached or reports an error
     */
    Map<String, Object> invoke(String toolName, Map<String, Object> args);

    /**
     * Lightweight reachability check used by health checks.
     */
    default boolean isReachable() {
        return true;
    }
}
