package com.sreagent.dispatch.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sreagent.core.model.IdentityProof;
import com.sreagent.core.model.WorkerKind;
import com.sreagent.core.model.WorkerRecord;
import com.sreagent.core.model.WorkerResult;
import com.sreagent.core.registry.LifecycleRegistry;
import com.sreagent.core.worker.ToolExecutor;
import com.sreagent.core.worker.WorkerFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;

import static org.hamcrest.Matchers.*;
import static org.mockito.Mockito.mock;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(WorkerController.class)
@Import(WorkerControllerTest.RegistryConfig.class)
class WorkerControllerTest {

    @TestConfiguration
    static class RegistryConfig {
        @Bean
        LifecycleRegistry lifecycleRegistry() {
            return new LifecycleRegistry(10);
        }

        @Bean
        WorkerFactory workerFactory(LifecycleRegistry registry) {
            return new WorkerFactory(registry, mock(ToolExecutor.class), new ObjectMapper());
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private LifecycleRegistry registry;

    private WorkerRecord active;
    private WorkerRecord destroyed;

    @BeforeEach
    void setUp() {
        active = registry.register(WorkerKind.LOG, IdentityProof.capture(1));
        registry.updateAction(active.id(), "get_error_logs", Map.of("hours", 24));
        WorkerRecord doomed = registry.register(WorkerKind.TRACE, IdentityProof.capture(2));
        destroyed = registry.deregister(doomed.id(), doomed.identityProof(),
                WorkerResult.success(doomed.id(), WorkerKind.TRACE, "get_recent_traces", 0.3, Map.of())).orElseThrow();
    }

    @Test
    @DisplayName("GET /workers lists the kind catalog")
    void catalog() throws Exception {
        mockMvc.perform(get("/api/v1/workers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.agents", hasSize(7)))
                .andExpect(jsonPath("$.agents[0].agent_type").value("log_worker"))
                .andExpect(jsonPath("$.agents[0].default_action").value("get_error_logs"))
                .andExpect(jsonPath("$.agents[1].actions", hasItem("check_all")));
    }

    @Test
    @DisplayName("GET /workers/active lists live workers")
    void activeWorkers() throws Exception {
        mockMvc.perform(get("/api/v1/workers/active"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.active_agents[*].agent_id", hasItem(active.id())))
                .andExpect(jsonPath("$.active_agents[*].agent_id", not(hasItem(destroyed.id()))))
                .andExpect(jsonPath("$.count").isNumber());
    }

    @Test
    @DisplayName("GET /workers/completed lists destroyed workers, newest first")
    void completedWorkers() throws Exception {
        mockMvc.perform(get("/api/v1/workers/completed").param("limit", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.completed_agents[0].agent_id").value(destroyed.id()))
                .andExpect(jsonPath("$.completed_agents[0].status").value("destroyed"))
                .andExpect(jsonPath("$.completed_agents[0].result_status").value("success"));
    }

    @Test
    @DisplayName("GET /workers/stats returns lifecycle counters")
    void stats() throws Exception {
        mockMvc.perform(get("/api/v1/workers/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_created").isNumber())
                .andExpect(jsonPath("$.total_destroyed").isNumber())
                .andExpect(jsonPath("$.active_agents").isArray());
    }

    @Test
    @DisplayName("GET /workers/{id} returns the record with its audit trail")
    void workerById() throws Exception {
        mockMvc.perform(get("/api/v1/workers/" + active.id()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.agent_id").value(active.id()))
                .andExpect(jsonPath("$.agent_type").value("log_worker"))
                .andExpect(jsonPath("$.status").value("executing"))
                .andExpect(jsonPath("$.action").value("get_error_logs"))
                .andExpect(jsonPath("$.identity_proof.process_id").isNumber())
                .andExpect(jsonPath("$.events").isArray());
    }

    @Test
    @DisplayName("GET /workers/{id} returns 404 for unknown workers")
    void unknownWorker() throws Exception {
        mockMvc.perform(get("/api/v1/workers/WKR-99999"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Worker WKR-99999 not found"));
    }
}
