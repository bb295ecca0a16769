package com.sreagent.mcp;

import io.modelcontextprotocol.client.McpSyncClient;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicator for the MCP tools server connection.
 */
@Component
@ConditionalOnProperty(prefix = "sreagent.mcp", name = "enabled", havingValue = "true")
public class McpHealthIndicator implements HealthIndicator {

    private final McpClientManager clientManager;
    private final McpProperties props;

    public McpHealthIndicator(McpClientManager clientManager, McpProperties props) {
        this.clientManager = clientManager;
        this.props = props;
    }

    @Override
    public Health health() {
        if (!clientManager.isConfigured()) {
            return Health.unknown().withDetail("reason", "not configured").build();
        }
        McpSyncClient client = clientManager.getClient();
        if (client == null) {
            return Health.down().withDetail("url", props.getUrl()).withDetail("reason", "unreachable").build();
        }
        try {
            client.ping();
            return Health.up().withDetail("url", props.getUrl()).build();
        } catch (Exception e) {
            return Health.down().withDetail("url", props.getUrl()).withDetail("error", e.getMessage()).build();
        }
    }
}
