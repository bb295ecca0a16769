package com.sreagent.core.events;

/**
 * Receives progress events, one at a time.
 * <p>
 * Used both as the sink a worker emits into and as the observer type registered with
 * {@link EventBroadcaster}. An observer that can no longer accept events signals it by
 * throwing; the broadcaster then drops it.
 */
@FunctionalInterface
public interface EventSink {

    EventSink NONE = event -> { };

    void accept(ProgressEvent event);
}
