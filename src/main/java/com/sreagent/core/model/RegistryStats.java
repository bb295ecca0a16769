package com.sreagent.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Aggregate lifecycle counters plus a brief line per active worker.
 */
public record RegistryStats(
    @JsonProperty("total_created") long totalCreated,
    @JsonProperty("total_destroyed") long totalDestroyed,
    @JsonProperty("currently_active") int currentlyActive,
    @JsonProperty("completed_in_history") int completedInHistory,
    @JsonProperty("active_agents") List<WorkerSummary> activeWorkers
) implements Serializable {

    public record WorkerSummary(
        @JsonProperty("agent_id") String id,
        WorkerKind type,
        WorkerStatus status,
        @JsonProperty("created_at") Instant createdAt,
        String action
    ) implements Serializable {}
}
