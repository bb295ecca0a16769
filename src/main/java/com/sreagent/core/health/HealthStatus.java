package com.sreagent.core.health;

import java.util.Map;

/**
 * Health of one orchestrator dependency. DEGRADED components keep the orchestrator
 * usable with reduced output (e.g. raw results instead of formatted replies).
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, String> metadata
) {
    public enum Status { UP, DOWN, DEGRADED }

    public HealthStatus {
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public static HealthStatus up(String component, String detail) {
        return new HealthStatus(component, Status.UP, detail, Map.of());
    }

    public static HealthStatus down(String component, String detail) {
        return new HealthStatus(component, Status.DOWN, detail, Map.of());
    }

    public static HealthStatus degraded(String component, String detail) {
        return new HealthStatus(component, Status.DEGRADED, detail, Map.of());
    }

    public boolean isDown() {
        return status == Status.DOWN;
    }
}
