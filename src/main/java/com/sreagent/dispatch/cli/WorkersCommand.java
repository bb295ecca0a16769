package com.sreagent.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: sre-agent workers [--active | --completed]
 * <p>
 * Without options lists the worker catalog; with {@code --active} the workers that
 * are running or in cooldown; with {@code --completed} the most recently destroyed ones.
 */
@Command(name = "workers", mixinStandardHelpOptions = true,
        description = "List worker kinds, active workers or completed workers")
@Component
public class WorkersCommand implements Callable<Integer> {

    @ArgGroup(exclusive = true)
    Selection selection;

    static class Selection {
        @Option(names = {"--active", "-a"}, description = "Show workers that are running or in cooldown")
        boolean active;

        @Option(names = {"--completed", "-c"}, description = "Show destroyed workers")
        boolean completed;
    }

    @Option(names = {"--limit", "-n"}, description = "Number of completed workers", defaultValue = "20")
    private int limit;

    private final OrchestratorApiClient apiClient;

    public WorkersCommand(OrchestratorApiClient apiClient) {
        this.apiClient = apiClient;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        try {
            if (selection != null && selection.active) {
                printActive(apiClient.activeWorkers());
            } else if (selection != null && selection.completed) {
                printCompleted(apiClient.completedWorkers(limit));
            } else {
                printCatalog(apiClient.catalog());
            }
            return 0;
        } catch (ApiClientException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }

    private void printCatalog(JsonNode body) {
        JsonNode kinds = body.path("agents");
        ConsoleOutput.info("Worker kinds (" + kinds.size() + "):");
        System.out.println();
        for (JsonNode kind : kinds) {
            System.out.printf("  %-20s %s%n", kind.path("agent_type").asText(), kind.path("description").asText());
            StringBuilder actions = new StringBuilder();
            for (JsonNode action : kind.path("actions")) {
                if (actions.length() > 0) actions.append(", ");
                actions.append(action.asText());
            }
            System.out.printf("  %-20s actions: %s (default %s)%n", "", actions,
                    kind.path("default_action").asText("-"));
        }
    }

    private void printActive(JsonNode body) {
        JsonNode workers = body.path("active_agents");
        if (workers.isEmpty()) {
            ConsoleOutput.info("No active workers.");
            return;
        }
        ConsoleOutput.info("Active workers (" + body.path("count").asInt(workers.size()) + "):");
        System.out.println();
        System.out.printf("  %-32s %-20s %-20s %s%n", "WORKER ID", "KIND", "STATUS", "ACTION");
        System.out.println("  " + "-".repeat(90));
        for (JsonNode worker : workers) {
            System.out.printf("  %-32s %-20s %-20s %s%n",
                    worker.path("agent_id").asText(),
                    worker.path("agent_type").asText(),
                    worker.path("status").asText(),
                    worker.path("action").asText("-"));
        }
    }

    private void printCompleted(JsonNode body) {
        JsonNode workers = body.path("completed_agents");
        if (workers.isEmpty()) {
            ConsoleOutput.info("No completed workers.");
            return;
        }
        ConsoleOutput.info("Completed workers (" + body.path("count").asInt(workers.size()) + "):");
        System.out.println();
        System.out.printf("  %-32s %-20s %-8s %-10s %s%n", "WORKER ID", "KIND", "RESULT", "LIFETIME", "ACTION");
        System.out.println("  " + "-".repeat(90));
        for (JsonNode worker : workers) {
            System.out.printf("  %-32s %-20s %-8s %-10s %s%n",
                    worker.path("agent_id").asText(),
                    worker.path("agent_type").asText(),
                    worker.path("result_status").asText("-"),
                    ConsoleOutput.formatSeconds(worker.path("duration_seconds").asDouble()),
                    worker.path("action").asText("-"));
        }
    }
}
