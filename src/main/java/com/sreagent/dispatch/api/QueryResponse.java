package com.sreagent.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sreagent.core.model.QueryOutcome;
import com.sreagent.core.model.WorkerKind;
import com.sreagent.core.model.WorkerResult;

import java.time.Instant;

/**
 * JSON response for a synchronous query.
 */
public record QueryResponse(
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("worker_kind") WorkerKind workerKind,
    String action,
    String reasoning,
    String result,
    WorkerResult raw,
    Instant timestamp
) {
    static QueryResponse from(QueryOutcome outcome) {
        return new QueryResponse(outcome.sessionId(), outcome.workerKind(), outcome.action(),
                outcome.reasoning(), outcome.formatted(), outcome.result(), outcome.timestamp());
    }
}
