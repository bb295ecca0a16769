package com.sreagent.dispatch.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sreagent.core.model.QueryOutcome;
import com.sreagent.core.model.RunRecord;
import com.sreagent.core.model.WorkerKind;
import com.sreagent.core.model.WorkerResult;
import com.sreagent.core.orchestrator.Orchestrator;
import com.sreagent.core.orchestrator.Requester;
import com.sreagent.core.orchestrator.RunHistory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(QueryController.class)
class QueryControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private Orchestrator orchestrator;

    @MockitoBean
    private SseStreamingService sseStreamingService;

    @MockitoBean
    private RunHistory runHistory;

    // ── POST /api/v1/queries ─────────────────────────────────────────

    @Test
    @DisplayName("POST /queries returns 202 Accepted with session_id")
    void submitQuery() throws Exception {
        when(orchestrator.generateSessionId()).thenReturn("a1b2c3d4");
        Requester requester = reply -> { };
        when(sseStreamingService.requesterFor("client-1")).thenReturn(requester);
        when(sseStreamingService.isConnected("client-1")).thenReturn(true);

        mockMvc.perform(post("/api/v1/queries")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new QueryRequest("  show errors ", "client-1"))))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.session_id").value("a1b2c3d4"))
                .andExpect(jsonPath("$.status").value("accepted"));

        verify(orchestrator).submit("a1b2c3d4", "show errors", requester);
    }

    @Test
    @DisplayName("POST /queries without client_id submits with no requester")
    void submitWithoutClient() throws Exception {
        when(orchestrator.generateSessionId()).thenReturn("a1b2c3d4");

        mockMvc.perform(post("/api/v1/queries")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"health\"}"))
                .andExpect(status().isAccepted());

        verify(orchestrator).submit("a1b2c3d4", "health", Requester.NONE);
    }

    @Test
    @DisplayName("POST /queries with a blank message returns 400")
    void blankMessage() throws Exception {
        mockMvc.perform(post("/api/v1/queries")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("message is required"));

        verify(orchestrator, never()).submit(anyString(), anyString(), any());
    }

    // ── POST /api/v1/query ───────────────────────────────────────────

    @Test
    @DisplayName("POST /query returns the formatted reply and raw result")
    void syncQuery() throws Exception {
        when(orchestrator.generateSessionId()).thenReturn("a1b2c3d4");
        var result = WorkerResult.success("WKR-00001", WorkerKind.HEALTH, "check_all", 1.5, Map.of("status", "UP"));
        when(orchestrator.handle(eq("a1b2c3d4"), eq("is it up?"), any())).thenReturn(new QueryOutcome(
                "a1b2c3d4", WorkerKind.HEALTH, "check_all", "full check", false, result, "## Healthy", Instant.now()));

        mockMvc.perform(post("/api/v1/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"is it up?\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.session_id").value("a1b2c3d4"))
                .andExpect(jsonPath("$.worker_kind").value("health_worker"))
                .andExpect(jsonPath("$.result").value("## Healthy"))
                .andExpect(jsonPath("$.raw.status").value("success"))
                .andExpect(jsonPath("$.raw.agent_id").value("WKR-00001"))
                .andExpect(jsonPath("$.raw.data.status").value("UP"));
    }

    @Test
    @DisplayName("POST /query with a missing message returns 400")
    void syncQueryMissingMessage() throws Exception {
        mockMvc.perform(post("/api/v1/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());
    }

    // ── GET /api/v1/stream ───────────────────────────────────────────

    @Test
    @DisplayName("GET /stream opens an SSE stream for the client")
    void stream() throws Exception {
        when(sseStreamingService.createEmitter("client-1")).thenReturn(new SseEmitter());

        mockMvc.perform(get("/api/v1/stream").param("client_id", "client-1")
                        .accept(MediaType.TEXT_EVENT_STREAM))
                .andExpect(request().asyncStarted());

        verify(sseStreamingService).createEmitter("client-1");
    }

    // ── GET /api/v1/history ──────────────────────────────────────────

    @Test
    @DisplayName("GET /history returns the recent runs")
    void history() throws Exception {
        when(runHistory.recent(QueryController.HISTORY_LIMIT)).thenReturn(List.of(
                new RunRecord("a1b2c3d4", "show errors", WorkerKind.LOG, "get_error_logs", "WKR-00001",
                        "success", 2.1, Instant.now())));

        mockMvc.perform(get("/api/v1/history"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.history", hasSize(1)))
                .andExpect(jsonPath("$.history[0].user_query").value("show errors"))
                .andExpect(jsonPath("$.history[0].agent").value("log_worker"))
                .andExpect(jsonPath("$.history[0].duration").value(2.1));
    }
}
