package com.sreagent.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle status of a worker record.
 * <p>
 * ACTIVE → EXECUTING → COMPLETED_COOLDOWN → DESTROYED. Only DESTROYED records live in
 * the registry's completed history.
 */
public enum WorkerStatus {
    ACTIVE,
    EXECUTING,
    COMPLETED_COOLDOWN,
    DESTROYED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
