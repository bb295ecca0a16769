package com.sreagent.core.orchestrator;

import com.sreagent.core.worker.Worker;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Keeps finished workers alive for a cooldown window and then runs their deferred
 * destruction.
 * <p>
 * Each pending worker is held by an explicit {@link CooldownHandle} in the scheduler's
 * table. The handle is removed exactly when the destruction task runs, so a worker is
 * "in cooldown" precisely while its handle is present. Pending cooldowns are abandoned
 * on shutdown.
 */
@Component
public class CooldownScheduler {

    private static final Logger log = LoggerFactory.getLogger(CooldownScheduler.class);

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "worker-cooldown");
        t.setDaemon(true);
        return t;
    });

    private final ConcurrentHashMap<String, CooldownHandle> pending = new ConcurrentHashMap<>();

    /**
     * Schedules {@code onExpiry} to run once {@code delay} has elapsed. Returns immediately.
     *
     * @param worker   the worker to keep alive until expiry
     * @param delay    the cooldown length
     * @param onExpiry the destruction to perform; runs on the cooldown thread
     * @return the handle held for the worker
     */
    public CooldownHandle schedule(Worker worker, Duration delay, Runnable onExpiry) {
        String workerId = worker.workerId();
        var handle = new CooldownHandle(worker, Instant.now().plus(delay));
        pending.put(workerId, handle);
        try {
            handle.future = scheduler.schedule(() -> expire(workerId, handle, onExpiry),
                    delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            pending.remove(workerId, handle);
            log.warn("Cooldown for {} not scheduled, scheduler is shut down", workerId);
            throw e;
        }
        log.debug("Worker {} in cooldown for {}s", workerId, delay.toSeconds());
        return handle;
    }

    private void expire(String workerId, CooldownHandle handle, Runnable onExpiry) {
        pending.remove(workerId, handle);
        try {
            onExpiry.run();
        } catch (RuntimeException e) {
            log.error("Deferred destruction of {} failed: {}", workerId, e.getMessage(), e);
        }
    }

    public boolean isPending(String workerId) {
        return pending.containsKey(workerId);
    }

    public Optional<CooldownHandle> handleFor(String workerId) {
        return Optional.ofNullable(pending.get(workerId));
    }

    public int pendingCount() {
        return pending.size();
    }

    public List<String> pendingWorkerIds() {
        return List.copyOf(pending.keySet());
    }

    @PreDestroy
    void shutdown() {
        int abandoned = pending.size();
        scheduler.shutdownNow();
        pending.clear();
        if (abandoned > 0) {
            log.info("Abandoned {} pending worker cooldown(s) on shutdown", abandoned);
        }
    }

    /**
     * A worker held alive until its scheduled destruction.
     */
    public static final class CooldownHandle {

        private final Worker worker;
        private final Instant expiresAt;
        private volatile ScheduledFuture<?> future;

        CooldownHandle(Worker worker, Instant expiresAt) {
            this.worker = worker;
            this.expiresAt = expiresAt;
        }

        public Worker worker() {
            return worker;
        }

        public Instant expiresAt() {
            return expiresAt;
        }

        public Duration remaining() {
            Duration left = Duration.between(Instant.now(), expiresAt);
            return left.isNegative() ? Duration.ZERO : left;
        }

        public boolean isDone() {
            ScheduledFuture<?> f = future;
            return f != null && f.isDone();
        }
    }
}
