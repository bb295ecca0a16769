package com.sreagent.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Envelope returned by every worker run, whether the work succeeded or failed.
 *
 * @param status          success or error
 * @param workerId        id of the worker that produced the result
 * @param workerKind      kind of that worker
 * @param action          the action that was executed
 * @param durationSeconds wall-clock execution time of the run
 * @param data            raw tool output on success, null on error
 * @param error           failure description on error, null on success
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkerResult(
    Status status,
    @JsonProperty("agent_id") String workerId,
    @JsonProperty("agent_type") WorkerKind workerKind,
    String action,
    @JsonProperty("duration_seconds") double durationSeconds,
    Map<String, Object> data,
    String error
) implements Serializable {

    public enum Status {
        SUCCESS, ERROR;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public static WorkerResult success(String workerId, WorkerKind kind, String action,
                                       double durationSeconds, Map<String, Object> data) {
        return new WorkerResult(Status.SUCCESS, workerId, kind, action, durationSeconds,
                data != null ? data : Map.of(), null);
    }

    public static WorkerResult failure(String workerId, WorkerKind kind, String action,
                                       double durationSeconds, String error) {
        return new WorkerResult(Status.ERROR, workerId, kind, action, durationSeconds, null, error);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    /**
     * The payload handed to the response formatter: tool data on success,
     * the whole envelope on failure.
     */
    public Map<String, Object> formatterPayload() {
        if (isSuccess()) {
            return data;
        }
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("status", status.wireName());
        envelope.put("agent_id", workerId);
        envelope.put("agent_type", workerKind.wireName());
        envelope.put("action", action);
        envelope.put("error", error);
        return envelope;
    }
}
