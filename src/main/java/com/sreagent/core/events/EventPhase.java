package com.sreagent.core.events;

import java.util.Locale;

/**
 * Phase of a single pipeline step as shown to observers.
 */
public enum EventPhase {
    PENDING,
    RUNNING,
    COMPLETED,
    ERROR;

    /** Lower-case name used on the wire ("running", "completed", ...). */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
