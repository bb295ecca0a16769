package com.sreagent.core.orchestrator;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sreagent.core.registry.LifecycleRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the process-wide registry, run history, and the pool utterances run on.
 */
@Configuration
public class OrchestratorConfig {

    @Bean
    public LifecycleRegistry lifecycleRegistry(OrchestratorProperties properties, ObjectMapper objectMapper) {
        return new LifecycleRegistry(properties.getMaxCompleted(), Clock.systemUTC(), objectMapper);
    }

    @Bean
    public RunHistory runHistory(OrchestratorProperties properties) {
        return new RunHistory(properties.getHistorySize());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService orchestratorExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "orchestrator-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
