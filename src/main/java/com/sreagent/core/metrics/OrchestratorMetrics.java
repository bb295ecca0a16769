package com.sreagent.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for worker lifecycles and utterance handling.
 */
@Service
public class OrchestratorMetrics {

    private final MeterRegistry registry;

    public OrchestratorMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordWorkerCreated(String workerKind) {
        Counter.builder("sreagent.workers.created")
                .tag("kind", workerKind)
                .register(registry)
                .increment();
    }

    public void recordWorkerDestroyed(String workerKind) {
        Counter.builder("sreagent.workers.destroyed")
                .tag("kind", workerKind)
                .register(registry)
                .increment();
    }

    /**
     * Records how long one worker run took.
     *
     * @param workerKind wire name of the worker kind
     * @param status     {@code success} or {@code error}
     */
    public void recordWorkerRun(String workerKind, String status, Duration duration) {
        Timer.builder("sreagent.worker.run.duration")
                .tag("kind", workerKind)
                .tag("status", status)
                .register(registry)
                .record(duration);
    }

    /**
     * @param reason {@code classifier_error} or {@code unknown_kind}
     */
    public void recordClassificationFallback(String reason) {
        Counter.builder("sreagent.classification.fallbacks")
                .description("Utterances routed to the default worker kind")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordFormatterFallback() {
        Counter.builder("sreagent.formatter.fallbacks")
                .description("Replies rendered as raw JSON because formatting failed")
                .register(registry)
                .increment();
    }

    public void recordObserverDropped() {
        Counter.builder("sreagent.observers.dropped")
                .description("Live observers removed after a failed delivery")
                .register(registry)
                .increment();
    }
}
