package com.sreagent.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Catalog entry describing one worker kind and the actions it supports.
 */
public record WorkerKindInfo(
    @JsonProperty("agent_type") WorkerKind kind,
    String description,
    List<String> actions,
    @JsonProperty("default_action") String defaultAction
) {
    public WorkerKindInfo {
        actions = actions != null ? List.copyOf(actions) : List.of();
    }
}
