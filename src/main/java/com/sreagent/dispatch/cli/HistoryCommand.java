package com.sreagent.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: sre-agent history
 * <p>
 * Displays recently handled requests as a table:
 * Session | Worker Kind | Action | Status | Duration | Request (truncated).
 */
@Command(name = "history", mixinStandardHelpOptions = true, description = "List recently handled requests")
@Component
public class HistoryCommand implements Callable<Integer> {

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "10")
    private int limit;

    private final OrchestratorApiClient apiClient;

    public HistoryCommand(OrchestratorApiClient apiClient) {
        this.apiClient = apiClient;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        List<JsonNode> runs = new ArrayList<>();
        try {
            apiClient.history().path("history").forEach(runs::add);
        } catch (ApiClientException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
        if (runs.isEmpty()) {
            ConsoleOutput.info("No requests handled yet.");
            return 0;
        }

        List<JsonNode> display = runs.size() > limit ? runs.subList(runs.size() - limit, runs.size()) : runs;

        ConsoleOutput.info("Requests (" + display.size() + " of " + runs.size() + "):");
        System.out.println();
        System.out.printf("  %-10s %-18s %-26s %-8s %-8s %s%n",
                "SESSION", "WORKER", "ACTION", "STATUS", "TIME", "REQUEST");
        System.out.println("  " + "-".repeat(100));
        for (JsonNode run : display) {
            System.out.printf("  %-10s %-18s %-26s %-8s %-8s %s%n",
                    run.path("session_id").asText(),
                    run.path("agent").asText(),
                    ConsoleOutput.truncate(run.path("action").asText(), 26),
                    run.path("status").asText(),
                    ConsoleOutput.formatSeconds(run.path("duration").asDouble()),
                    ConsoleOutput.truncate(run.path("user_query").asText(), 30));
        }
        return 0;
    }
}
