package com.sreagent.core.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sreagent.core.events.EventPhase;
import com.sreagent.core.events.EventSink;
import com.sreagent.core.events.ProgressEvent;
import com.sreagent.core.logging.MdcContext;
import com.sreagent.core.model.IdentityProof;
import com.sreagent.core.model.WorkerKind;
import com.sreagent.core.model.WorkerResult;
import com.sreagent.core.registry.LifecycleRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * A short-lived unit of work bound to one {@link WorkerKind}.
 * <p>
 * A worker registers itself with the {@link LifecycleRegistry} when constructed, runs
 * exactly one action through its kind's {@link WorkerBehavior}, and is then kept alive
 * by the orchestrator until its cooldown expires and it is deregistered.
 * <p>
 * Every progress event is appended to the registry's audit trail first and then
 * pushed to the {@link EventSink}, synchronously on the calling thread.
 */
public class Worker implements WorkerContext {

    private static final Logger log = LoggerFactory.getLogger(Worker.class);

    private final WorkerKind kind;
    private final WorkerBehavior behavior;
    private final ToolExecutor tools;
    private final LifecycleRegistry registry;
    private final EventSink sink;
    private final ObjectMapper objectMapper;
    private final IdentityProof identityProof;
    private final String id;

    Worker(WorkerKind kind, WorkerBehavior behavior, ToolExecutor tools, LifecycleRegistry registry,
           EventSink sink, ObjectMapper objectMapper, long handle) {
        this.kind = kind;
        this.behavior = behavior;
        this.tools = tools;
        this.registry = registry;
        this.sink = sink != null ? sink : EventSink.NONE;
        this.objectMapper = objectMapper;
        this.identityProof = IdentityProof.capture(handle);
        this.id = registry.register(kind, identityProof).id();
    }

    /**
     * Runs one action to completion. Any failure of the behaviour or the tool executor,
     * errors included, is reported as an error envelope and an ERROR event; only a
     * {@link VirtualMachineError} propagates.
     *
     * @param action the requested action; blank means the kind's default
     * @param params action parameters, may be null
     * @return the result envelope
     */
    public WorkerResult run(String action, Map<String, Object> params) {
        String resolvedAction = action == null || action.isBlank() ? behavior.defaultAction() : action;
        Map<String, Object> safeParams = params != null ? params : Map.of();
        String description = kind.description();
        long startNanos = System.nanoTime();

        MdcContext.setWorker(id, kind.wireName());
        try {
            registry.updateAction(id, resolvedAction, safeParams);
            emit("Analyzing request", EventPhase.COMPLETED, "Action: " + resolvedAction);
            emit("Creating " + description, EventPhase.RUNNING, "ID: " + id);

            WorkerResult result;
            try {
                emit(description + " active", EventPhase.COMPLETED);
                emit("Connecting to tool server", EventPhase.RUNNING);

                Map<String, Object> data = behavior.execute(resolvedAction, safeParams, this);
                if (data == null) {
                    data = Map.of();
                }

                emit("Processing results", EventPhase.COMPLETED, "Got " + sizeOf(data) + " bytes");
                double seconds = elapsedSeconds(startNanos);
                emit(description + " completed", EventPhase.COMPLETED,
                        String.format("Duration: %.1fs", seconds));
                result = WorkerResult.success(id, kind, resolvedAction, seconds, data);
            } catch (VirtualMachineError e) {
                throw e;
            } catch (Throwable e) {
                // linkage and assertion errors from a behaviour or tool client still end in an envelope
                double seconds = elapsedSeconds(startNanos);
                String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                log.error("Worker {} failed running '{}': {}", id, resolvedAction, message, e);
                emit(description + " failed", EventPhase.ERROR, message);
                result = WorkerResult.failure(id, kind, resolvedAction, seconds, message);
            }

            registry.markCooldown(id);
            return result;
        } finally {
            MdcContext.clearWorker();
        }
    }

    @Override
    public ProgressEvent emit(String stepLabel, EventPhase phase, String detail) {
        ProgressEvent event = ProgressEvent.of(stepLabel, phase, detail, id, kind.wireName());
        registry.recordEvent(id, event);
        try {
            sink.accept(event);
        } catch (RuntimeException e) {
            log.warn("Event sink rejected '{}' from {}: {}", stepLabel, id, e.getMessage());
        }
        return event;
    }

    @Override
    public String workerId() {
        return id;
    }

    @Override
    public WorkerKind kind() {
        return kind;
    }

    @Override
    public ToolExecutor tools() {
        return tools;
    }

    public IdentityProof identityProof() {
        return identityProof;
    }

    private int sizeOf(Map<String, Object> data) {
        try {
            return objectMapper.writeValueAsBytes(data).length;
        } catch (JsonProcessingException e) {
            log.debug("Could not serialize result of {} for sizing: {}", id, e.getMessage());
            return String.valueOf(data).getBytes(StandardCharsets.UTF_8).length;
        }
    }

    private static double elapsedSeconds(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }

    @Override
    public String toString() {
        return "Worker[" + id + ", " + kind.wireName() + "]";
    }
}
