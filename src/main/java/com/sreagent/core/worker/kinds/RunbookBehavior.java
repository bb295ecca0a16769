package com.sreagent.core.worker.kinds;

import com.sreagent.core.events.EventPhase;
import com.sreagent.core.worker.WorkerContext;

/**
 * Controls runbook monitoring, which restarts the application automatically when
 * errors are detected.
 */
public class RunbookBehavior extends WatchControlBehavior {

    static final String RUNBOOK_ID = "RB-SRE-001";

    public RunbookBehavior() {
        super("runbook monitoring", "start_runbook_monitoring", "stop_runbook_monitoring",
                "get_runbook_monitoring_status", 5);
    }

    @Override
    protected void beforeStart(int intervalMinutes, WorkerContext context) {
        context.emit("Activating Runbook " + RUNBOOK_ID, EventPhase.RUNNING, "Auto-restart on errors enabled");
        context.emit("Setting check interval: " + intervalMinutes + " min", EventPhase.RUNNING);
    }

    @Override
    protected void afterStart(WorkerContext context) {
        context.emit("Runbook monitoring active", EventPhase.COMPLETED, "Will auto-restart on detected errors");
    }
}
