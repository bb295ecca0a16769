package com.sreagent.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sreagent.core.worker.ToolExecutionException;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.spec.McpSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link McpToolExecutor} with a mocked MCP client.
 */
class McpToolExecutorTest {

    private McpClientManager clientManager;
    private McpSyncClient client;
    private McpToolExecutor executor;

    @BeforeEach
    void setUp() {
        clientManager = mock(McpClientManager.class);
        client = mock(McpSyncClient.class);
        when(clientManager.getClient()).thenReturn(client);
        executor = new McpToolExecutor(clientManager, new ObjectMapper());
    }

    private static McpSchema.CallToolResult text(String text, boolean isError) {
        return McpSchema.CallToolResult.builder().addTextContent(text).isError(isError).build();
    }

    @Nested
    @DisplayName("invoke")
    class InvokeTests {

        @Test
        @DisplayName("sends tool name and arguments and parses the JSON object")
        void parsesObject() {
            when(client.callTool(any())).thenReturn(text("{\"logs\":[\"a\"],\"count\":1}", false));

            Map<String, Object> result = executor.invoke("get_error_logs", Map.of("hours", 24));

            assertEquals(List.of("a"), result.get("logs"));
            assertEquals(1, result.get("count"));
            ArgumentCaptor<McpSchema.CallToolRequest> request = ArgumentCaptor.forClass(McpSchema.CallToolRequest.class);
            verify(client).callTool(request.capture());
            assertEquals("get_error_logs", request.getValue().name());
            assertEquals(Map.of("hours", 24), request.getValue().arguments());
        }

        @Test
        @DisplayName("tool error result becomes ToolExecutionException")
        void toolError() {
            when(client.callTool(any())).thenReturn(text("App not found", true));

            var e = assertThrows(ToolExecutionException.class, () -> executor.invoke("get_app_status", Map.of()));
            assertEquals("App not found", e.getMessage());
            assertEquals("get_app_status", e.getToolName());
        }

        @Test
        @DisplayName("transport failure becomes ToolExecutionException")
        void transportFailure() {
            when(client.callTool(any())).thenThrow(new IllegalStateException("connection reset"));

            var e = assertThrows(ToolExecutionException.class, () -> executor.invoke("get_app_status", Map.of()));
            assertTrue(e.getMessage().contains("connection reset"));
            assertInstanceOf(IllegalStateException.class, e.getCause());
        }

        @Test
        @DisplayName("unreachable server is reported without a call")
        void unreachable() {
            when(clientManager.getClient()).thenReturn(null);
            when(clientManager.isConfigured()).thenReturn(true);

            var e = assertThrows(ToolExecutionException.class, () -> executor.invoke("get_app_status", Map.of()));
            assertEquals("MCP tools server is unreachable", e.getMessage());
            verifyNoInteractions(client);
        }

        @Test
        @DisplayName("unconfigured server is reported as such")
        void notConfigured() {
            when(clientManager.getClient()).thenReturn(null);
            when(clientManager.isConfigured()).thenReturn(false);

            var e = assertThrows(ToolExecutionException.class, () -> executor.invoke("get_app_status", Map.of()));
            assertEquals("MCP tools server is not configured", e.getMessage());
        }
    }

    @Nested
    @DisplayName("parse")
    class ParseTests {

        @Test
        @DisplayName("wraps non-object JSON under result")
        void wrapsArray() {
            assertEquals(Map.of("result", List.of(1, 2)), executor.parse("[1,2]"));
        }

        @Test
        @DisplayName("wraps plain text under text")
        void wrapsText() {
            assertEquals(Map.of("text", "all good"), executor.parse("all good"));
        }

        @Test
        @DisplayName("blank output is an empty map")
        void blank() {
            assertTrue(executor.parse("").isEmpty());
        }
    }

    @Test
    @DisplayName("isReachable pings the server")
    void isReachable() {
        assertTrue(executor.isReachable());
        verify(client).ping();

        doThrow(new IllegalStateException("timeout")).when(client).ping();
        assertFalse(executor.isReachable());

        when(clientManager.getClient()).thenReturn(null);
        assertFalse(executor.isReachable());
    }
}
