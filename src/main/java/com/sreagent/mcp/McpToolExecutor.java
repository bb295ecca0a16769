package com.sreagent.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sreagent.core.worker.ToolExecutionException;
import com.sreagent.core.worker.ToolExecutor;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * {@link ToolExecutor} backed by the MCP tools server.
 * <p>
 * Tool results arrive as text content holding JSON. A JSON object becomes the result map;
 * any other JSON value is wrapped under {@code result}, and non-JSON text under
 * {@code text}.
 */
@Component
public class McpToolExecutor implements ToolExecutor {

    private static final Logger log = LoggerFactory.getLogger(McpToolExecutor.class);

    private final McpClientManager clientManager;
    private final ObjectMapper objectMapper;

    public McpToolExecutor(McpClientManager clientManager, ObjectMapper objectMapper) {
        this.clientManager = clientManager;
        this.objectMapper = objectMapper;
    }

    @Override
    public Map<String, Object> invoke(String toolName, Map<String, Object> args) {
        McpSyncClient client = clientManager.getClient();
        if (client == null) {
            throw new ToolExecutionException(toolName, clientManager.isConfigured()
                    ? "MCP tools server is unreachable"
                    : "MCP tools server is not configured");
        }

        log.debug("Calling tool {} with {}", toolName, args);
        long start = System.currentTimeMillis();
        McpSchema.CallToolResult result;
        try {
            result = client.callTool(new McpSchema.CallToolRequest(toolName, args != null ? args : Map.of()));
        } catch (RuntimeException e) {
            throw new ToolExecutionException(toolName, "Tool call " + toolName + " failed: " + e.getMessage(), e);
        }
        log.info("Tool {} returned in {}ms", toolName, System.currentTimeMillis() - start);

        String text = textOf(result);
        if (Boolean.TRUE.equals(result.isError())) {
            throw new ToolExecutionException(toolName, text.isBlank() ? "Tool " + toolName + " reported an error" : text);
        }
        return parse(text);
    }

    @Override
    public boolean isReachable() {
        McpSyncClient client = clientManager.getClient();
        if (client == null) {
            return false;
        }
        try {
            client.ping();
            return true;
        } catch (RuntimeException e) {
            log.debug("MCP ping failed: {}", e.getMessage());
            return false;
        }
    }

    private static String textOf(McpSchema.CallToolResult result) {
        if (result.content() == null) {
            return "";
        }
        return result.content().stream()
                .filter(McpSchema.TextContent.class::isInstance)
                .map(c -> ((McpSchema.TextContent) c).text())
                .collect(Collectors.joining("\n"))
                .trim();
    }

    Map<String, Object> parse(String text) {
        if (text.isBlank()) {
            return Map.of();
        }
        try {
            JsonNode node = objectMapper.readTree(text);
            if (node.isObject()) {
                @SuppressWarnings("unchecked")
                Map<String, Object> map = objectMapper.convertValue(node, LinkedHashMap.class);
                return map;
            }
            Map<String, Object> wrapped = new LinkedHashMap<>();
            wrapped.put("result", objectMapper.convertValue(node, Object.class));
            return wrapped;
        } catch (JsonProcessingException e) {
            log.debug("Tool output is not JSON, returning it as text");
            Map<String, Object> wrapped = new LinkedHashMap<>();
            wrapped.put("text", text);
            return wrapped;
        }
    }
}
