package com.sreagent.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sreagent.core.events.ProgressEvent;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of one worker's registry entry.
 * <p>
 * The registry owns the live entry; every query returns a fresh snapshot so readers
 * never observe a half-applied update.
 *
 * @param id              unique worker id
 * @param seq             registration sequence number backing the id
 * @param kind            worker kind
 * @param identityProof   diagnostic identity evidence
 * @param createdAt       registration time
 * @param completedAt     destruction time, null until destroyed
 * @param status          lifecycle status
 * @param currentAction   last action assigned, null until assigned
 * @param currentParams   params of the last action, null until assigned
 * @param events          audit trail in emission order
 * @param resultStatus    result envelope status, set at destruction
 * @param resultSizeBytes serialized size of the result envelope, set at destruction
 * @param executionSeconds run duration reported by the worker, set at destruction
 * @param lifetime        {@code completedAt - createdAt}, set at destruction
 */
public record WorkerRecord(
    @JsonProperty("agent_id") String id,
    long seq,
    @JsonProperty("agent_type") WorkerKind kind,
    @JsonProperty("identity_proof") IdentityProof identityProof,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("completed_at") Instant completedAt,
    WorkerStatus status,
    @JsonProperty("action") String currentAction,
    @JsonProperty("params") Map<String, Object> currentParams,
    List<ProgressEvent> events,
    @JsonProperty("result_status") String resultStatus,
    @JsonProperty("result_size_bytes") Long resultSizeBytes,
    @JsonProperty("execution_seconds") Double executionSeconds,
    Duration lifetime
) implements Serializable {

    @JsonIgnore
    public boolean isDestroyed() {
        return status == WorkerStatus.DESTROYED;
    }

    @JsonProperty("duration_seconds")
    public Double lifetimeSeconds() {
        return lifetime != null ? lifetime.toMillis() / 1000.0 : null;
    }
}
