package com.sreagent.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Human-readable answer to one utterance, pushed to the requester.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatReply(
    @JsonProperty("session_id") String sessionId,
    String message,
    @JsonProperty("agent_type") WorkerKind workerKind,
    @JsonProperty("agent_id") String workerId,
    Instant timestamp
) {}
