package com.sreagent.core.registry;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sreagent.core.events.ProgressEvent;
import com.sreagent.core.model.IdentityProof;
import com.sreagent.core.model.RegistryStats;
import com.sreagent.core.model.WorkerKind;
import com.sreagent.core.model.WorkerRecord;
import com.sreagent.core.model.WorkerResult;
import com.sreagent.core.model.WorkerStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Single source of truth for worker existence and audit history.
 * <p>
 * Holds an <em>active</em> table of live workers and a bounded <em>completed</em>
 * history of destroyed ones. Every operation runs under one lock, so registrations,
 * event appends and the active → completed move are linearizable with respect to each
 * other and no reader ever sees a record in both tables or in neither.
 * <p>
 * Operations addressed at an unknown or already destroyed worker are no-ops: late
 * events from a racing task never resurrect or alter a finalized record.
 */
public class LifecycleRegistry {

    private static final Logger log = LoggerFactory.getLogger(LifecycleRegistry.class);

    public static final int DEFAULT_MAX_COMPLETED = 200;

    private final Object lock = new Object();
    private final Map<String, Entry> active = new LinkedHashMap<>();
    /** Oldest first; entries are final snapshots. */
    private final Deque<WorkerRecord> completed = new ArrayDeque<>();
    private final int maxCompleted;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    private long totalCreated;
    private long totalDestroyed;

    public LifecycleRegistry() {
        this(DEFAULT_MAX_COMPLETED);
    }

    public LifecycleRegistry(int maxCompleted) {
        this(maxCompleted, Clock.systemUTC(), new ObjectMapper().findAndRegisterModules());
    }

    public LifecycleRegistry(int maxCompleted, Clock clock, ObjectMapper objectMapper) {
        if (maxCompleted < 1) {
            throw new IllegalArgumentException("maxCompleted must be at least 1, was " + maxCompleted);
        }
        this.maxCompleted = maxCompleted;
        this.clock = clock;
        this.objectMapper = objectMapper;
    }

    /**
     * Registers a newly created worker.
     *
     * @param kind          the worker kind
     * @param identityProof the worker's identity evidence
     * @return snapshot of the new ACTIVE record, carrying the assigned id
     */
    public WorkerRecord register(WorkerKind kind, IdentityProof identityProof) {
        synchronized (lock) {
            long seq = ++totalCreated;
            var entry = new Entry(String.format("WKR-%05d", seq), seq, kind, identityProof, clock.instant());
            active.put(entry.id, entry);
            log.info("WORKER CREATED: {} [{}] handle={} pid={} thread={}",
                    entry.id, kind.wireName(), identityProof.handle(),
                    identityProof.processId(), identityProof.threadName());
            return entry.snapshot();
        }
    }

    /**
     * Appends an event to an active worker's audit trail. No-op for unknown or
     * destroyed workers.
     */
    public void recordEvent(String workerId, ProgressEvent event) {
        synchronized (lock) {
            Entry entry = active.get(workerId);
            if (entry != null) {
                entry.events.add(event);
            } else {
                log.debug("Ignoring event '{}' for inactive worker {}", event.stepLabel(), workerId);
            }
        }
    }

    /**
     * Records the action a worker is about to execute and moves it to EXECUTING.
     * No-op for unknown workers.
     */
    public void updateAction(String workerId, String action, Map<String, Object> params) {
        synchronized (lock) {
            Entry entry = active.get(workerId);
            if (entry != null) {
                entry.action = action;
                entry.params = params != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(params))
                        : Map.of();
                entry.status = WorkerStatus.EXECUTING;
            }
        }
    }

    /**
     * Marks a worker whose run has returned as waiting out its cooldown.
     * No-op for unknown workers.
     */
    public void markCooldown(String workerId) {
        synchronized (lock) {
            Entry entry = active.get(workerId);
            if (entry != null) {
                entry.status = WorkerStatus.COMPLETED_COOLDOWN;
            }
        }
    }

    /**
     * Moves a worker from the active table to the completed history.
     *
     * @param workerId      the worker to destroy
     * @param identityProof the proof the worker registered with; a mismatching handle is rejected
     * @param result        the worker's result envelope
     * @return the finalized record, or empty when the worker was not active
     */
    public Optional<WorkerRecord> deregister(String workerId, IdentityProof identityProof, WorkerResult result) {
        synchronized (lock) {
            Entry entry = active.get(workerId);
            if (entry == null) {
                return Optional.empty();
            }
            if (identityProof != null && identityProof.handle() != entry.identityProof.handle()) {
                log.warn("Refusing to deregister {}: identity handle {} does not match registered handle {}",
                        workerId, identityProof.handle(), entry.identityProof.handle());
                return Optional.empty();
            }
            active.remove(workerId);
            totalDestroyed++;

            Instant completedAt = clock.instant();
            if (completedAt.isBefore(entry.createdAt)) {
                completedAt = entry.createdAt;
            }
            entry.completedAt = completedAt;
            entry.status = WorkerStatus.DESTROYED;
            entry.resultStatus = result != null ? result.status().wireName() : "unknown";
            entry.resultSizeBytes = sizeOf(result);
            entry.executionSeconds = result != null ? result.durationSeconds() : null;

            WorkerRecord finalized = entry.snapshot();
            completed.addLast(finalized);
            while (completed.size() > maxCompleted) {
                completed.removeFirst();
            }
            log.info("WORKER DESTROYED: {} [{}] lifetime={}s status={}",
                    workerId, entry.kind.wireName(),
                    String.format("%.1f", finalized.lifetimeSeconds()), entry.resultStatus);
            return Optional.of(finalized);
        }
    }

    public List<WorkerRecord> getActive() {
        synchronized (lock) {
            var snapshots = new ArrayList<WorkerRecord>(active.size());
            for (Entry entry : active.values()) {
                snapshots.add(entry.snapshot());
            }
            return snapshots;
        }
    }

    /**
     * Most recently destroyed first.
     */
    public List<WorkerRecord> getCompleted(int limit) {
        synchronized (lock) {
            var result = new ArrayList<WorkerRecord>(Math.min(Math.max(limit, 0), completed.size()));
            Iterator<WorkerRecord> newestFirst = completed.descendingIterator();
            while (newestFirst.hasNext() && result.size() < limit) {
                result.add(newestFirst.next());
            }
            return result;
        }
    }

    /**
     * Looks up a worker in the active table first, then in the completed history.
     */
    public Optional<WorkerRecord> getById(String workerId) {
        synchronized (lock) {
            Entry entry = active.get(workerId);
            if (entry != null) {
                return Optional.of(entry.snapshot());
            }
            Iterator<WorkerRecord> newestFirst = completed.descendingIterator();
            while (newestFirst.hasNext()) {
                WorkerRecord record = newestFirst.next();
                if (record.id().equals(workerId)) {
                    return Optional.of(record);
                }
            }
            return Optional.empty();
        }
    }

    public RegistryStats getStats() {
        synchronized (lock) {
            var summaries = new ArrayList<RegistryStats.WorkerSummary>(active.size());
            for (Entry e : active.values()) {
                summaries.add(new RegistryStats.WorkerSummary(e.id, e.kind, e.status, e.createdAt, e.action));
            }
            return new RegistryStats(totalCreated, totalDestroyed, active.size(), completed.size(), summaries);
        }
    }

    public int getMaxCompleted() {
        return maxCompleted;
    }

    private long sizeOf(WorkerResult result) {
        if (result == null) {
            return 0;
        }
        try {
            return objectMapper.writeValueAsString(result).getBytes(StandardCharsets.UTF_8).length;
        } catch (Exception e) {
            log.debug("Could not serialize result for sizing, using toString: {}", e.getMessage());
            return result.toString().getBytes(StandardCharsets.UTF_8).length;
        }
    }

    /** Mutable registry-side state for one worker; only touched while holding the lock. */
    private static final class Entry {
        private final String id;
        private final long seq;
        private final WorkerKind kind;
        private final IdentityProof identityProof;
        private final Instant createdAt;
        private final List<ProgressEvent> events = new ArrayList<>();

        private WorkerStatus status = WorkerStatus.ACTIVE;
        private String action;
        private Map<String, Object> params;
        private Instant completedAt;
        private String resultStatus;
        private Long resultSizeBytes;
        private Double executionSeconds;

        private Entry(String id, long seq, WorkerKind kind, IdentityProof identityProof, Instant createdAt) {
            this.id = id;
            this.seq = seq;
            this.kind = kind;
            this.identityProof = identityProof;
            this.createdAt = createdAt;
        }

        private WorkerRecord snapshot() {
            Duration lifetime = completedAt != null ? Duration.between(createdAt, completedAt) : null;
            return new WorkerRecord(id, seq, kind, identityProof, createdAt, completedAt, status,
                    action, params, List.copyOf(events), resultStatus, resultSizeBytes,
                    executionSeconds, lifetime);
        }
    }
}
