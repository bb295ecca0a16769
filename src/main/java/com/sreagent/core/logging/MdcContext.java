package com.sreagent.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing orchestrator-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String SESSION_ID = "sessionId";
    public static final String WORKER_ID = "workerId";
    public static final String WORKER_KIND = "workerKind";

    private MdcContext() {}

    public static void setSession(String sessionId) {
        MDC.put(SESSION_ID, sessionId);
    }

    public static void setWorker(String workerId, String workerKind) {
        MDC.put(WORKER_ID, workerId);
        MDC.put(WORKER_KIND, workerKind);
    }

    public static void clearWorker() {
        MDC.remove(WORKER_ID);
        MDC.remove(WORKER_KIND);
    }

    public static void clear() {
        MDC.remove(SESSION_ID);
        clearWorker();
    }
}
