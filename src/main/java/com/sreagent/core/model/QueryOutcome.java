package com.sreagent.core.model;

import java.time.Instant;

/**
 * Everything produced while handling one utterance.
 *
 * @param sessionId     the session the utterance was handled under
 * @param workerKind    the kind actually run, after any fallback
 * @param action        the action actually run
 * @param reasoning     the classifier's reasoning, or the fallback reason
 * @param fallback      whether the default kind/action replaced the classifier's choice
 * @param result        the worker's result envelope
 * @param formatted     the formatted reply sent to the requester
 * @param timestamp     when handling finished
 */
public record QueryOutcome(
    String sessionId,
    WorkerKind workerKind,
    String action,
    String reasoning,
    boolean fallback,
    WorkerResult result,
    String formatted,
    Instant timestamp
) {
    public String workerId() {
        return result.workerId();
    }
}
