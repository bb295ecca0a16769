package com.sreagent.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * The closed family of ephemeral worker kinds.
 * <p>
 * Each kind is bound to exactly one behaviour in
 * {@link com.sreagent.core.worker.WorkerFactory}.
 */
public enum WorkerKind {

    LOG("log_worker", "Log Analysis Worker"),
    HEALTH("health_worker", "Health Check Worker"),
    TRACE("trace_worker", "Trace Analysis Worker"),
    DASHBOARD("dashboard_worker", "SRE Dashboard Worker"),
    DEPLOYMENT("deployment_worker", "Deployment Management Worker"),
    MONITOR("monitor_worker", "Monitoring Control Worker"),
    RUNBOOK("runbook_worker", "Runbook Automation Worker");

    private final String wireName;
    private final String description;

    WorkerKind(String wireName, String description) {
        this.wireName = wireName;
        this.description = description;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public String description() {
        return description;
    }

    /**
     * Resolves a kind from the name a classifier (or an operator) used for it.
     * <p>
     * Accepts the wire name ({@code log_worker}), the enum name ({@code LOG}), hyphenated
     * forms ({@code log-worker}) and the {@code _agent} suffix ({@code log_agent}).
     * {@code monitoring_*} is accepted as an alias of {@link #MONITOR}.
     *
     * @param name the name to resolve, may be null
     * @return the matching kind, or empty when the name is not recognized
     */
    public static Optional<WorkerKind> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        if (normalized.endsWith("_agent")) {
            normalized = normalized.substring(0, normalized.length() - "_agent".length());
        } else if (normalized.endsWith("_worker")) {
            normalized = normalized.substring(0, normalized.length() - "_worker".length());
        }
        if (normalized.equals("monitoring")) {
            normalized = "monitor";
        }
        for (WorkerKind kind : values()) {
            if (kind.name().equalsIgnoreCase(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
