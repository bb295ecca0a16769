package com.sreagent.core.worker;

import java.util.List;
import java.util.Map;

/**
 * Kind-specific execution logic of a worker.
 * <p>
 * Implementations dispatch on {@code action} to one of their named operations, each of
 * which delegates to the context's {@link ToolExecutor}. An action the behaviour does
 * not recognize runs {@link #defaultAction()} instead of failing.
 */
public interface WorkerBehavior {

    /**
     * Executes one action.
     *
     * @param action  the requested action
     * @param params  action parameters, never null
     * @param context the running worker
     * @return the raw result
     * @throws RuntimeException on any failure; the worker converts it into an error envelope
     */
    Map<String, Object> execute(String action, Map<String, Object> params, WorkerContext context);

    /** Actions this behaviour understands, in catalog order. */
    List<String> supportedActions();

    /** The action run when the requested one is not supported. */
    String defaultAction();
}
