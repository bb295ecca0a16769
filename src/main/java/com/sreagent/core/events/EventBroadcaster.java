package com.sreagent.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory fan-out of progress events to every currently subscribed observer.
 * <p>
 * Delivery is synchronous on the broadcasting thread, so a single observer sees events
 * from one worker in the order they were broadcast. An observer that throws is removed
 * from the subscriber set and never affects delivery to the others. Events are not
 * buffered: late subscribers only see future events.
 */
@Service
public class EventBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(EventBroadcaster.class);

    private final CopyOnWriteArrayList<Registration> subscribers = new CopyOnWriteArrayList<>();

    /**
     * Broadcast an event to all subscribers.
     *
     * @param event the event to deliver
     */
    public void broadcast(ProgressEvent event) {
        log.debug("Broadcasting '{}' [{}] from {} to {} subscriber(s)",
                event.stepLabel(), event.phase(), event.ownerId(), subscribers.size());

        for (Registration registration : subscribers) {
            deliverSafely(registration, event);
        }
    }

    /**
     * Subscribe an observer to all future events.
     *
     * @param observer callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(EventSink observer) {
        var registration = new Registration(observer);
        subscribers.add(registration);
        log.debug("Observer subscribed ({} total)", subscribers.size());
        return () -> {
            if (subscribers.remove(registration)) {
                log.debug("Observer unsubscribed ({} remaining)", subscribers.size());
            }
        };
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    /**
     * Handle for cancelling a subscription. Unsubscribing twice is harmless.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Registration registration, ProgressEvent event) {
        try {
            registration.observer.accept(event);
        } catch (Exception e) {
            subscribers.remove(registration);
            log.info("Dropped observer after failed delivery of '{}': {}", event.stepLabel(), e.getMessage());
        }
    }

    /** Identity wrapper so the same observer may be subscribed more than once. */
    private static final class Registration {
        private final EventSink observer;

        private Registration(EventSink observer) {
            this.observer = observer;
        }
    }
}
