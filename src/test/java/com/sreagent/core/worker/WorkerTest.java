package com.sreagent.core.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sreagent.core.events.EventPhase;
import com.sreagent.core.events.ProgressEvent;
import com.sreagent.core.model.WorkerKind;
import com.sreagent.core.model.WorkerKindInfo;
import com.sreagent.core.model.WorkerRecord;
import com.sreagent.core.model.WorkerResult;
import com.sreagent.core.model.WorkerStatus;
import com.sreagent.core.registry.LifecycleRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link Worker} and {@link WorkerFactory}.
 */
class WorkerTest {

    private LifecycleRegistry registry;
    private ToolExecutor tools;
    private WorkerFactory factory;

    @BeforeEach
    void setUp() {
        registry = new LifecycleRegistry(50);
        tools = mock(ToolExecutor.class);
        factory = new WorkerFactory(registry, tools, new ObjectMapper());
    }

    @Nested
    @DisplayName("creation")
    class CreationTests {

        @Test
        @DisplayName("registers the worker with a fresh identity handle")
        void registersOnCreate() {
            Worker first = factory.create(WorkerKind.LOG, null);
            Worker second = factory.create(WorkerKind.LOG, null);

            WorkerRecord record = registry.getById(first.workerId()).orElseThrow();
            assertEquals(WorkerStatus.ACTIVE, record.status());
            assertEquals(WorkerKind.LOG, first.kind());
            assertNotEquals(first.identityProof().handle(), second.identityProof().handle());
            assertEquals(ProcessHandle.current().pid(), first.identityProof().processId());
            assertNotEquals(first.workerId(), second.workerId());
        }

        @Test
        @DisplayName("every kind has a behaviour and a catalog entry")
        void catalogCoversAllKinds() {
            List<WorkerKindInfo> catalog = factory.catalog();

            assertEquals(WorkerKind.values().length, catalog.size());
            for (WorkerKindInfo info : catalog) {
                assertFalse(info.actions().isEmpty(), info.kind().wireName());
                assertNotNull(WorkerFactory.behaviorFor(info.kind()));
            }
            assertEquals(WorkerKind.LOG, catalog.get(0).kind());
        }
    }

    @Nested
    @DisplayName("run")
    class RunTests {

        @Test
        @DisplayName("success emits the pipeline in order and records it")
        void successPipeline() {
            when(tools.invoke(eq("get_deployment_history"), anyMap())).thenReturn(Map.of("deployments", List.of()));
            List<ProgressEvent> sunk = new ArrayList<>();
            Worker worker = factory.create(WorkerKind.DEPLOYMENT, sunk::add);

            WorkerResult result = worker.run("get_deployment_history", Map.of());

            assertTrue(result.isSuccess());
            assertEquals(worker.workerId(), result.workerId());
            assertEquals(Map.of("deployments", List.of()), result.data());
            assertEquals(List.of(
                    "Analyzing request",
                    "Creating Deployment Management Worker",
                    "Deployment Management Worker active",
                    "Connecting to tool server",
                    "Fetching deployment history",
                    "Processing results",
                    "Deployment Management Worker completed"),
                    sunk.stream().map(ProgressEvent::stepLabel).toList());

            WorkerRecord record = registry.getById(worker.workerId()).orElseThrow();
            assertEquals(sunk, record.events());
            assertEquals(WorkerStatus.COMPLETED_COOLDOWN, record.status());
            assertEquals("get_deployment_history", record.currentAction());
        }

        @Test
        @DisplayName("blank action resolves to the kind's default")
        void blankAction() {
            when(tools.invoke(anyString(), anyMap())).thenReturn(Map.of());
            Worker worker = factory.create(WorkerKind.TRACE, null);

            WorkerResult result = worker.run("  ", null);

            assertEquals("get_recent_traces", result.action());
            verify(tools).invoke("get_recent_traces", Map.of("limit", 20));
        }

        @Test
        @DisplayName("tool failure becomes an error envelope and an ERROR event")
        void toolFailure() {
            when(tools.invoke(anyString(), anyMap()))
                    .thenThrow(new ToolExecutionException("get_app_status", "MCP tools server is unreachable"));
            List<ProgressEvent> sunk = new ArrayList<>();
            Worker worker = factory.create(WorkerKind.DEPLOYMENT, sunk::add);

            WorkerResult result = worker.run("get_app_status", Map.of());

            assertFalse(result.isSuccess());
            assertEquals("MCP tools server is unreachable", result.error());
            assertNull(result.data());
            ProgressEvent last = sunk.get(sunk.size() - 1);
            assertEquals("Deployment Management Worker failed", last.stepLabel());
            assertEquals(EventPhase.ERROR, last.phase());
            assertEquals(WorkerStatus.COMPLETED_COOLDOWN,
                    registry.getById(worker.workerId()).orElseThrow().status());
        }

        @Test
        @DisplayName("a linkage error from the tool client still ends in an error envelope")
        void linkageError() {
            when(tools.invoke(anyString(), anyMap()))
                    .thenThrow(new NoClassDefFoundError("io/modelcontextprotocol/spec/McpSchema"));
            List<ProgressEvent> sunk = new ArrayList<>();
            Worker worker = factory.create(WorkerKind.LOG, sunk::add);

            WorkerResult result = worker.run("get_error_logs", Map.of());

            assertFalse(result.isSuccess());
            assertEquals("io/modelcontextprotocol/spec/McpSchema", result.error());
            assertEquals(EventPhase.ERROR, sunk.get(sunk.size() - 1).phase());
            assertEquals(WorkerStatus.COMPLETED_COOLDOWN,
                    registry.getById(worker.workerId()).orElseThrow().status());
        }

        @Test
        @DisplayName("an assertion error from a behaviour still ends in an error envelope")
        void assertionError() {
            when(tools.invoke(anyString(), anyMap())).thenThrow(new AssertionError("unexpected tool state"));
            Worker worker = factory.create(WorkerKind.HEALTH, null);

            WorkerResult result = worker.run("check_app_health", Map.of());

            assertFalse(result.isSuccess());
            assertEquals("unexpected tool state", result.error());
        }

        @Test
        @DisplayName("virtual machine errors propagate")
        void virtualMachineErrorPropagates() {
            when(tools.invoke(anyString(), anyMap())).thenThrow(new OutOfMemoryError("heap"));
            Worker worker = factory.create(WorkerKind.LOG, null);

            assertThrows(OutOfMemoryError.class, () -> worker.run("get_error_logs", Map.of()));
        }

        @Test
        @DisplayName("missing trace id becomes an error envelope")
        void missingTraceId() {
            Worker worker = factory.create(WorkerKind.TRACE, null);

            WorkerResult result = worker.run("get_trace_details", Map.of());

            assertFalse(result.isSuccess());
            assertEquals("trace_id is required", result.error());
            verifyNoInteractions(tools);
        }

        @Test
        @DisplayName("a throwing sink does not fail the run or the audit trail")
        void throwingSink() {
            when(tools.invoke(anyString(), anyMap())).thenReturn(Map.of("ok", true));
            Worker worker = factory.create(WorkerKind.DEPLOYMENT, e -> {
                throw new IllegalStateException("observer gone");
            });

            WorkerResult result = worker.run("start_app", Map.of());

            assertTrue(result.isSuccess());
            assertEquals(7, registry.getById(worker.workerId()).orElseThrow().events().size());
        }

        @Test
        @DisplayName("separate workers keep separate tool results")
        void separateResults() {
            when(tools.invoke(eq("get_error_logs"), anyMap())).thenReturn(Map.of("source", "logs"));
            when(tools.invoke(eq("get_app_status"), anyMap())).thenReturn(Map.of("source", "app"));

            WorkerResult logs = factory.create(WorkerKind.LOG, null).run("get_error_logs", Map.of());
            WorkerResult app = factory.create(WorkerKind.DEPLOYMENT, null).run("get_app_status", Map.of());

            assertEquals("logs", logs.data().get("source"));
            assertEquals("app", app.data().get("source"));
            assertNotEquals(logs.workerId(), app.workerId());
        }
    }

    @Test
    @DisplayName("WorkerParams tolerates strings, numbers and junk")
    void workerParams() {
        Map<String, Object> params = Map.of("a", 3, "b", "7", "c", "x", "d", " ");
        assertEquals(3, WorkerParams.intParam(params, "a", 0));
        assertEquals(7, WorkerParams.intParam(params, "b", 0));
        assertEquals(9, WorkerParams.intParam(params, "c", 9));
        assertEquals(9, WorkerParams.intParam(params, "missing", 9));
        assertEquals("def", WorkerParams.stringParam(params, "d", "def"));
        assertEquals("7", WorkerParams.stringParam(params, "b", "def"));
    }
}
