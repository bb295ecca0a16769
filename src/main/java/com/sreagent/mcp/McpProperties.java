package com.sreagent.mcp;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Connection settings for the remote MCP tools server.
 *
 * <pre>
 * sreagent:
 *   mcp:
 *     enabled: true
 *     url: https://sre-tools.example.com
 *     api-key: secret
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "sreagent.mcp")
public class McpProperties {

    private boolean enabled = false;
    private String url = "";
    private String endpoint = "/mcp";
    private String apiKey = "";
    private String apiKeyHeader = "X-API-Key";
    private Duration requestTimeout = Duration.ofSeconds(120);

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }
    public String getEndpoint() { return endpoint; }
    public void setEndpoint(String endpoint) { this.endpoint = endpoint; }
    public String getApiKey() { return apiKey; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }
    public String getApiKeyHeader() { return apiKeyHeader; }
    public void setApiKeyHeader(String apiKeyHeader) { this.apiKeyHeader = apiKeyHeader; }
    public Duration getRequestTimeout() { return requestTimeout; }
    public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }

    /**
     * Returns {@code true} when MCP is enabled and a server URL is set.
     */
    public boolean isConfigured() {
        return enabled && url != null && !url.isBlank();
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}
