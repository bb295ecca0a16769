package com.sreagent.core.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sreagent.core.events.EventSink;
import com.sreagent.core.model.WorkerKind;
import com.sreagent.core.model.WorkerKindInfo;
import com.sreagent.core.registry.LifecycleRegistry;
import com.sreagent.core.worker.kinds.DashboardBehavior;
import com.sreagent.core.worker.kinds.DeploymentBehavior;
import com.sreagent.core.worker.kinds.HealthBehavior;
import com.sreagent.core.worker.kinds.LogBehavior;
import com.sreagent.core.worker.kinds.MonitorBehavior;
import com.sreagent.core.worker.kinds.RunbookBehavior;
import com.sreagent.core.worker.kinds.TraceBehavior;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Creates workers for the closed set of {@link WorkerKind}s.
 * <p>
 * Behaviours are stateless and shared; each created {@link Worker} gets a fresh identity
 * handle and registers itself with the registry.
 */
@Component
public class WorkerFactory {

    private static final Map<WorkerKind, WorkerBehavior> BEHAVIORS;

    static {
        Map<WorkerKind, WorkerBehavior> behaviors = new EnumMap<>(WorkerKind.class);
        behaviors.put(WorkerKind.LOG, new LogBehavior());
        behaviors.put(WorkerKind.HEALTH, new HealthBehavior());
        behaviors.put(WorkerKind.TRACE, new TraceBehavior());
        behaviors.put(WorkerKind.DASHBOARD, new DashboardBehavior());
        behaviors.put(WorkerKind.DEPLOYMENT, new DeploymentBehavior());
        behaviors.put(WorkerKind.MONITOR, new MonitorBehavior());
        behaviors.put(WorkerKind.RUNBOOK, new RunbookBehavior());
        BEHAVIORS = Collections.unmodifiableMap(behaviors);
    }

    private final LifecycleRegistry registry;
    private final ToolExecutor toolExecutor;
    private final ObjectMapper objectMapper;
    private final AtomicLong handles = new AtomicLong();

    public WorkerFactory(LifecycleRegistry registry, ToolExecutor toolExecutor, ObjectMapper objectMapper) {
        this.registry = registry;
        this.toolExecutor = toolExecutor;
        this.objectMapper = objectMapper;
    }

    /**
     * Creates and registers a worker of the given kind.
     *
     * @param kind the worker kind
     * @param sink receives every event the worker emits, after it has been recorded
     */
    public Worker create(WorkerKind kind, EventSink sink) {
        return new Worker(kind, behaviorFor(kind), toolExecutor, registry, sink, objectMapper,
                handles.incrementAndGet());
    }

    public static WorkerBehavior behaviorFor(WorkerKind kind) {
        WorkerBehavior behavior = BEHAVIORS.get(kind);
        if (behavior == null) {
            throw new IllegalArgumentException("No behaviour registered for " + kind);
        }
        return behavior;
    }

    /** Kinds and their actions, in declaration order. */
    public List<WorkerKindInfo> catalog() {
        return Arrays.stream(WorkerKind.values())
                .map(kind -> {
                    WorkerBehavior behavior = behaviorFor(kind);
                    return new WorkerKindInfo(kind, kind.description(),
                            behavior.supportedActions(), behavior.defaultAction());
                })
                .toList();
    }
}
