package com.sreagent.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Implementation-level evidence that a worker object really existed.
 * <p>
 * Diagnostic only; never used for record equality. The handle is unique among live
 * workers and is checked when a worker is deregistered.
 *
 * @param handle     opaque per-object handle assigned at construction
 * @param processId  owning JVM process id
 * @param threadId   id of the thread that created the worker
 * @param threadName name of the thread that created the worker
 */
public record IdentityProof(
    long handle,
    @JsonProperty("process_id") long processId,
    @JsonProperty("thread_id") long threadId,
    @JsonProperty("thread_name") String threadName
) implements Serializable {

    /**
     * Captures the current process and thread for the given handle.
     */
    public static IdentityProof capture(long handle) {
        Thread current = Thread.currentThread();
        return new IdentityProof(handle, ProcessHandle.current().pid(), current.getId(), current.getName());
    }
}
