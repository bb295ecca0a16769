package com.sreagent.dispatch.api;

import com.sreagent.core.health.HealthCheckService;
import com.sreagent.core.health.HealthStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(HealthController.class)
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private HealthCheckService healthCheckService;

    @Test
    @DisplayName("GET /health returns 200 when nothing is down")
    void healthy() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("tool_server", HealthStatus.Status.UP, "Tool server reachable", Map.of()),
                new HealthStatus("llm", HealthStatus.Status.DEGRADED, "No LLM API key configured", Map.of()),
                new HealthStatus("registry", HealthStatus.Status.UP, "0 active worker(s)",
                        Map.of("total_created", "3"))));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.components.llm.status").value("DEGRADED"))
                .andExpect(jsonPath("$.components.registry.metadata.total_created").value("3"))
                .andExpect(jsonPath("$.components.tool_server.metadata").doesNotExist());
    }

    @Test
    @DisplayName("GET /health returns 503 when a component is down")
    void down() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("tool_server", HealthStatus.Status.DOWN, "Tool server unreachable", Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("DOWN"))
                .andExpect(jsonPath("$.components.tool_server.detail").value("Tool server unreachable"));
    }
}
