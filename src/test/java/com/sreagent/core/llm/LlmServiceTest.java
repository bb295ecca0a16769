package com.sreagent.core.llm;

import com.sreagent.core.model.Intent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.client.ChatClient.CallResponseSpec;
import org.springframework.ai.chat.client.ChatClient.ChatClientRequestSpec;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link LlmService}.
 * <p>
 * Mocks the entire {@link ChatClient} chain so no real LLM calls are made.
 */
class LlmServiceTest {

    private ChatClientRequestSpec mockRequestSpec;
    private CallResponseSpec mockCallResponse;
    private LlmService llmService;

    @BeforeEach
    void setUp() {
        ChatClient mockChatClient = mock(ChatClient.class);
        mockRequestSpec = mock(ChatClientRequestSpec.class);
        mockCallResponse = mock(CallResponseSpec.class);

        when(mockChatClient.prompt()).thenReturn(mockRequestSpec);
        when(mockRequestSpec.system(anyString())).thenReturn(mockRequestSpec);
        when(mockRequestSpec.user(anyString())).thenReturn(mockRequestSpec);
        when(mockRequestSpec.call()).thenReturn(mockCallResponse);

        ChatClient.Builder mockBuilder = mock(ChatClient.Builder.class);
        when(mockBuilder.build()).thenReturn(mockChatClient);

        llmService = new LlmService(mockBuilder, "http://test:1234");
    }

    @Nested
    @DisplayName("structuredCall")
    class StructuredCallTests {

        @Test
        @DisplayName("sends system prompt and user prompt with format instructions")
        void sendsPrompts() {
            when(mockCallResponse.content()).thenReturn("""
                    {"agent":"log_worker","action":"get_error_logs","params":{},"reasoning":"errors"}
                    """);

            llmService.structuredCall("System prompt", "User prompt", Intent.class);

            verify(mockRequestSpec).system("System prompt");
            ArgumentCaptor<String> userCaptor = ArgumentCaptor.forClass(String.class);
            verify(mockRequestSpec).user(userCaptor.capture());
            assertTrue(userCaptor.getValue().startsWith("User prompt\n\n"));
            assertTrue(userCaptor.getValue().length() > "User prompt\n\n".length());
        }

        @Test
        @DisplayName("deserializes the JSON reply into the target type")
        void deserializes() {
            when(mockCallResponse.content()).thenReturn("""
                    {"agent":"trace_worker","action":"get_trace_details","params":{"trace_id":"abc"},"reasoning":"trace"}
                    """);

            Intent intent = llmService.structuredCall("sys", "user", Intent.class);

            assertEquals("trace_worker", intent.workerKind());
            assertEquals("get_trace_details", intent.action());
            assertEquals(Map.of("trace_id", "abc"), intent.params());
        }

        @Test
        @DisplayName("empty reply throws LlmEmptyResponseException")
        void emptyReply() {
            when(mockCallResponse.content()).thenReturn("  ");

            var e = assertThrows(LlmEmptyResponseException.class,
                    () -> llmService.structuredCall("sys", "user", Intent.class));
            assertEquals("Intent", e.getExpected());
        }

        @Test
        @DisplayName("non-JSON reply throws LlmParseException")
        void nonJsonReply() {
            when(mockCallResponse.content()).thenReturn("I think you want the log worker.");

            var e = assertThrows(LlmParseException.class,
                    () -> llmService.structuredCall("sys", "user", Intent.class));
            assertEquals("I think you want the log worker.", e.getExcerpt());
        }
    }

    @Nested
    @DisplayName("textCall")
    class TextCallTests {

        @Test
        @DisplayName("returns the trimmed reply without format instructions")
        void returnsTrimmed() {
            when(mockCallResponse.content()).thenReturn("\n## Report\nAll healthy\n");

            String text = llmService.textCall("sys", "user");

            assertEquals("## Report\nAll healthy", text);
            verify(mockRequestSpec).user("user");
        }

        @Test
        @DisplayName("null reply throws LlmEmptyResponseException")
        void nullReply() {
            when(mockCallResponse.content()).thenReturn(null);

            assertThrows(LlmEmptyResponseException.class, () -> llmService.textCall("sys", "user"));
        }
    }

    @Test
    @DisplayName("parseWithJackson tolerates fences and unknown fields")
    void lenientParsing() {
        Intent intent = llmService.parseWithJackson("""
                ```json
                {"agent":"health_worker","action":"check_all","confidence":0.9}
                ```
                """, Intent.class);

        assertEquals("health_worker", intent.workerKind());
        assertTrue(intent.params().isEmpty());
        assertEquals("", intent.reasoning());
    }

    @Test
    @DisplayName("stripCodeFence removes markdown fences")
    void stripCodeFence() {
        assertEquals("{\"a\":1}", LlmService.stripCodeFence("```json\n{\"a\":1}\n```"));
        assertEquals("{\"a\":1}", LlmService.stripCodeFence("```\n{\"a\":1}```"));
        assertEquals("{\"a\":1}", LlmService.stripCodeFence(" {\"a\":1} "));
    }
}
