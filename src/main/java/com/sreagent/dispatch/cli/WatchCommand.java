package com.sreagent.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * CLI command: sre-agent watch
 * <p>
 * Connects to the server's SSE stream and prints progress events and replies as they
 * arrive, until interrupted or until {@code --max-events} frames have been shown.
 */
@Command(name = "watch", mixinStandardHelpOptions = true, description = "Stream live progress events")
@Component
public class WatchCommand implements Callable<Integer> {

    @Option(names = {"--client-id"}, description = "Stream id to register under; replies to queries submitted with the same id are shown too")
    private String clientId;

    @Option(names = {"--max-events"}, description = "Stop after this many events (0 = unlimited)", defaultValue = "0")
    private int maxEvents;

    private final OrchestratorApiClient apiClient;

    public WatchCommand(OrchestratorApiClient apiClient) {
        this.apiClient = apiClient;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Watching " + apiClient.getBaseUrl() + " (Ctrl+C to stop)");
        System.out.println();

        AtomicInteger shown = new AtomicInteger();
        try {
            apiClient.stream(clientId, (eventName, data) -> {
                print(eventName, data);
                return maxEvents <= 0 || shown.incrementAndGet() < maxEvents;
            });
        } catch (ApiClientException e) {
            ConsoleOutput.error(e.getMessage());
            if (e.getStatusCode() < 0) {
                ConsoleOutput.info("Start the server first: sre-agent serve");
            }
            return 1;
        }
        ConsoleOutput.info("Stream closed after " + shown.get() + " event(s)");
        return 0;
    }

    static void print(String eventName, JsonNode data) {
        switch (eventName) {
            case "connected" -> ConsoleOutput.watchEvent(eventName, null,
                    "client " + data.path("client_id").asText());
            case "chat_response" -> ConsoleOutput.watchEvent(eventName, null,
                    "[" + data.path("session_id").asText() + "] " + data.path("message").asText());
            case "pipeline_event" -> {
                String detail = data.path("detail").asText("");
                ConsoleOutput.watchEvent(eventName, data.path("status").asText(null),
                        data.path("agent_type").asText() + " " + data.path("step").asText()
                                + (detail.isEmpty() ? "" : " | " + detail));
            }
            default -> ConsoleOutput.watchEvent(eventName, null, data.toString());
        }
    }
}
