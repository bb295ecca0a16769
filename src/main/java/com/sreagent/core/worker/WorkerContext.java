package com.sreagent.core.worker;

import com.sreagent.core.events.EventPhase;
import com.sreagent.core.events.ProgressEvent;
import com.sreagent.core.model.WorkerKind;

/**
 * What a {@link WorkerBehavior} may use while executing: the worker's identity, its
 * tool executor, and the ability to emit progress events into the worker's audit trail.
 */
public interface WorkerContext {

    String workerId();

    WorkerKind kind();

    ToolExecutor tools();

    ProgressEvent emit(String stepLabel, EventPhase phase, String detail);

    default ProgressEvent emit(String stepLabel, EventPhase phase) {
        return emit(stepLabel, phase, "");
    }
}
