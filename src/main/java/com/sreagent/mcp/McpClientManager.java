package com.sreagent.mcp;

import io.modelcontextprotocol.client.McpClient;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.client.transport.HttpClientStreamableHttpTransport;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Owns the MCP sync client for the tools server.
 * <p>
 * The client is created lazily on first use, authenticated with the configured API key
 * header, and shared by all workers. A failed connection attempt is retried on the next
 * call.
 */
@Component
public class McpClientManager {

    private static final Logger log = LoggerFactory.getLogger(McpClientManager.class);

    private final McpProperties props;

    private volatile McpSyncClient client;

    public McpClientManager(McpProperties props) {
        this.props = props;
    }

    @PostConstruct
    void init() {
        if (!props.isConfigured()) {
            log.info("MCP tools server disabled or not configured");
            return;
        }
        log.info("MCP tools server configured at {}{}", props.getUrl(), props.getEndpoint());

        // Startup connectivity check, listing the server's tools
        try {
            var c = getClient();
            if (c != null) {
                var tools = c.listTools();
                log.info("MCP tools server connected, {} tool(s) available",
                        tools.tools() != null ? tools.tools().size() : 0);
                if (tools.tools() != null) {
                    tools.tools().forEach(t -> log.debug("  MCP tool: {}", t.name()));
                }
            }
        } catch (Exception e) {
            log.warn("MCP tools server startup check failed: {}", e.getMessage());
        }
    }

    /**
     * Returns the shared client, connecting if needed.
     *
     * @return the MCP sync client, or null if not configured or the server is unreachable
     */
    public McpSyncClient getClient() {
        if (!props.isConfigured()) {
            return null;
        }
        McpSyncClient current = client;
        if (current != null) {
            return current;
        }
        synchronized (this) {
            if (client == null) {
                client = connect();
            }
            return client;
        }
    }

    private McpSyncClient connect() {
        try {
            var transportBuilder = HttpClientStreamableHttpTransport.builder(props.getUrl())
                    .endpoint(props.getEndpoint());
            if (props.hasApiKey()) {
                transportBuilder.customizeRequest(req -> req.header(props.getApiKeyHeader(), props.getApiKey()));
            }
            var c = McpClient.sync(transportBuilder.build())
                    .requestTimeout(props.getRequestTimeout())
                    .build();
            c.initialize();
            log.info("MCP client connected to {}", props.getUrl());
            return c;
        } catch (Exception e) {
            log.warn("Failed to connect MCP client to {}: {}", props.getUrl(), e.getMessage());
            return null;
        }
    }

    public boolean hasClient() {
        return client != null;
    }

    public boolean isConfigured() {
        return props.isConfigured();
    }

    @PreDestroy
    void shutdown() {
        McpSyncClient current = client;
        client = null;
        if (current != null) {
            try {
                current.close();
                log.info("MCP client disconnected");
            } catch (Exception e) {
                log.debug("Error closing MCP client: {}", e.getMessage());
            }
        }
    }
}
