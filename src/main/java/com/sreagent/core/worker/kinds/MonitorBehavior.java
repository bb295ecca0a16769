package com.sreagent.core.worker.kinds;

import com.sreagent.core.events.EventPhase;
import com.sreagent.core.worker.WorkerContext;

/**
 * Controls continuous monitoring on the tool server.
 */
public class MonitorBehavior extends WatchControlBehavior {

    public MonitorBehavior() {
        super("continuous monitoring", "start_monitoring", "stop_monitoring", "get_monitoring_status", 2);
    }

    @Override
    protected void beforeStart(int intervalMinutes, WorkerContext context) {
        context.emit("Starting continuous monitoring", EventPhase.RUNNING, "Interval: " + intervalMinutes + " min");
    }

    @Override
    protected void afterStart(WorkerContext context) {
        context.emit("Monitoring activated", EventPhase.COMPLETED);
    }
}
