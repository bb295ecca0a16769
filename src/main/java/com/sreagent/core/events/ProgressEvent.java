package com.sreagent.core.events;

import com.fasterxml.jackson.annotation.JsonValue;

import java.io.Serializable;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A step in a worker's (or the orchestrator's) execution pipeline.
 * <p>
 * Immutable once created: the same instance is appended to the registry audit trail
 * and pushed to live observers.
 *
 * @param eventId    short unique id of this event
 * @param stepLabel  human-readable description of what is happening
 * @param phase      pending / running / completed / error
 * @param detail     free-text context, never null
 * @param ownerId    id of the worker (or orchestrator session) that emitted the event
 * @param ownerKind  wire name of the worker kind, or {@code "orchestrator"}
 * @param timestamp  when the event was created
 * @param attributes optional extra fields for observers (e.g. {@code inspect_url})
 */
public record ProgressEvent(
    String eventId,
    String stepLabel,
    EventPhase phase,
    String detail,
    String ownerId,
    String ownerKind,
    Instant timestamp,
    Map<String, Object> attributes
) implements Serializable {

    public static final String ORCHESTRATOR = "orchestrator";

    public ProgressEvent {
        detail = detail != null ? detail : "";
        attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
    }

    public static ProgressEvent of(String stepLabel, EventPhase phase, String detail,
                                   String ownerId, String ownerKind) {
        return of(stepLabel, phase, detail, ownerId, ownerKind, Map.of());
    }

    public static ProgressEvent of(String stepLabel, EventPhase phase, String detail,
                                   String ownerId, String ownerKind, Map<String, Object> attributes) {
        return new ProgressEvent(newEventId(), stepLabel, phase, detail, ownerId, ownerKind,
                Instant.now(), attributes);
    }

    /**
     * Flattened representation used for SSE frames and JSON responses.
     */
    @JsonValue
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", eventId);
        map.put("step", stepLabel);
        map.put("status", phase.wireName());
        map.put("detail", detail);
        map.put("agent_id", ownerId);
        map.put("agent_type", ownerKind);
        map.put("timestamp", timestamp.toString());
        map.putAll(attributes);
        return map;
    }

    private static String newEventId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
