package com.sreagent.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class OrchestratorMetricsTest {

    private SimpleMeterRegistry registry;
    private OrchestratorMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new OrchestratorMetrics(registry);
    }

    @Test
    @DisplayName("worker creation and destruction are counted per kind")
    void lifecycleCounters() {
        metrics.recordWorkerCreated("log_worker");
        metrics.recordWorkerCreated("log_worker");
        metrics.recordWorkerCreated("trace_worker");
        metrics.recordWorkerDestroyed("log_worker");

        assertEquals(2.0, registry.find("sreagent.workers.created").tag("kind", "log_worker").counter().count());
        assertEquals(1.0, registry.find("sreagent.workers.created").tag("kind", "trace_worker").counter().count());
        assertEquals(1.0, registry.find("sreagent.workers.destroyed").tag("kind", "log_worker").counter().count());
    }

    @Test
    @DisplayName("recordWorkerRun records by kind and status")
    void recordWorkerRun() {
        metrics.recordWorkerRun("health_worker", "success", Duration.ofMillis(1500));
        metrics.recordWorkerRun("health_worker", "error", Duration.ofMillis(200));

        var success = registry.find("sreagent.worker.run.duration")
                .tags("kind", "health_worker", "status", "success").timer();
        assertNotNull(success);
        assertEquals(1, success.count());
        assertEquals(1500.0, success.totalTime(TimeUnit.MILLISECONDS), 0.001);
        assertNotNull(registry.find("sreagent.worker.run.duration").tag("status", "error").timer());
    }

    @Test
    @DisplayName("fallbacks and dropped observers are counted")
    void fallbackCounters() {
        metrics.recordClassificationFallback("unknown_kind");
        metrics.recordFormatterFallback();
        metrics.recordFormatterFallback();
        metrics.recordObserverDropped();

        assertEquals(1.0, registry.find("sreagent.classification.fallbacks")
                .tag("reason", "unknown_kind").counter().count());
        assertEquals(2.0, registry.find("sreagent.formatter.fallbacks").counter().count());
        assertEquals(1.0, registry.find("sreagent.observers.dropped").counter().count());
    }
}
