package com.sreagent.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One handled utterance, as kept in the orchestrator's run history.
 */
public record RunRecord(
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("user_query") String query,
    @JsonProperty("agent") WorkerKind workerKind,
    String action,
    @JsonProperty("agent_id") String workerId,
    String status,
    @JsonProperty("duration") double durationSeconds,
    Instant timestamp
) {}
