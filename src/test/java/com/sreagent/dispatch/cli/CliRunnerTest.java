package com.sreagent.dispatch.cli;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class CliRunnerTest {

    private final ByteArrayOutputStream capture = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private OrchestratorApiClient apiClient;
    private CliRunner runner;

    @BeforeEach
    void setUp() {
        originalOut = System.out;
        System.setOut(new PrintStream(capture, true));
        apiClient = mock(OrchestratorApiClient.class);
        CommandLine.IFactory factory = new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == WatchCommand.class) {
                    return (K) new WatchCommand(apiClient);
                }
                if (cls == StatsCommand.class) {
                    return (K) new StatsCommand(apiClient);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
        runner = new CliRunner(new SreAgentCommand(), factory);
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
    }

    @Test
    @DisplayName("serve mode skips the command line")
    void serveSkipsPicocli() {
        runner.run("serve", "--server.port=9090");

        assertEquals(0, runner.getExitCode());
        assertEquals("", capture.toString());
        verifyNoInteractions(apiClient);
    }

    @Test
    @DisplayName("exit code of the executed command is exposed")
    void exposesExitCode() {
        when(apiClient.stats()).thenThrow(new ApiClientException("HTTP 500", 500));

        runner.run("stats");

        assertEquals(1, runner.getExitCode());
    }

    @Test
    @DisplayName("uncaught API errors are printed and exit 1")
    void apiErrorsHandled() {
        when(apiClient.getBaseUrl()).thenThrow(new ApiClientException("Cannot connect to orchestrator server", -1));

        runner.run("watch");

        assertEquals(1, runner.getExitCode());
        assertTrue(capture.toString().contains("Cannot connect to orchestrator server"));
    }
}
