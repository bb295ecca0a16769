package com.sreagent.core.health;

import com.sreagent.core.events.EventBroadcaster;
import com.sreagent.core.model.RegistryStats;
import com.sreagent.core.registry.LifecycleRegistry;
import com.sreagent.core.worker.ToolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Checks the orchestrator's dependencies: the MCP tools server, the LLM configuration and
 * the lifecycle registry. Shared by {@code /api/v1/health} and the {@code health} command.
 */
@Service
public class HealthCheckService {

    static final String TOOL_SERVER = "tool_server";
    static final String LLM = "llm";
    static final String REGISTRY = "registry";

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final ToolExecutor toolExecutor;
    private final LifecycleRegistry registry;
    private final EventBroadcaster broadcaster;
    private final String llmApiKey;

    public HealthCheckService(
            @Autowired(required = false) ToolExecutor toolExecutor,
            LifecycleRegistry registry,
            EventBroadcaster broadcaster,
            @Value("${spring.ai.openai.api-key:}") String llmApiKey) {
        this.toolExecutor = toolExecutor;
        this.registry = registry;
        this.broadcaster = broadcaster;
        this.llmApiKey = llmApiKey;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkToolServer());
        results.add(checkLlm());
        results.add(checkRegistry());
        return results;
    }

    private HealthStatus checkToolServer() {
        if (toolExecutor == null) {
            return HealthStatus.down(TOOL_SERVER, "No ToolExecutor configured");
        }
        try {
            if (toolExecutor.isReachable()) {
                return HealthStatus.up(TOOL_SERVER, "Tool server reachable");
            }
            return HealthStatus.down(TOOL_SERVER, "Tool server unreachable");
        } catch (Exception e) {
            log.warn("Tool server health check failed: {}", e.getMessage());
            return HealthStatus.down(TOOL_SERVER, "Tool server error: " + e.getMessage());
        }
    }

    private HealthStatus checkLlm() {
        if (llmApiKey == null || llmApiKey.isBlank() || llmApiKey.equals("not-set")) {
            return HealthStatus.degraded(LLM, "No LLM API key configured; replies fall back to raw results");
        }
        return HealthStatus.up(LLM, "LLM API key configured");
    }

    private HealthStatus checkRegistry() {
        RegistryStats stats = registry.getStats();
        return new HealthStatus(REGISTRY, HealthStatus.Status.UP,
                stats.currentlyActive() + " active worker(s)",
                Map.of("total_created", String.valueOf(stats.totalCreated()),
                        "total_destroyed", String.valueOf(stats.totalDestroyed()),
                        "observers", String.valueOf(broadcaster.subscriberCount())));
    }
}
