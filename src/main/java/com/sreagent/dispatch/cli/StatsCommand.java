package com.sreagent.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: sre-agent stats
 * <p>
 * Prints the registry's lifecycle counters and a line per live worker.
 */
@Command(name = "stats", mixinStandardHelpOptions = true, description = "Show worker lifecycle statistics")
@Component
public class StatsCommand implements Callable<Integer> {

    private final OrchestratorApiClient apiClient;

    public StatsCommand(OrchestratorApiClient apiClient) {
        this.apiClient = apiClient;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        JsonNode stats;
        try {
            stats = apiClient.stats();
        } catch (ApiClientException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        System.out.println("  Created:    " + stats.path("total_created").asLong());
        System.out.println("  Destroyed:  " + stats.path("total_destroyed").asLong());
        System.out.println("  Active:     " + stats.path("currently_active").asInt());
        System.out.println("  History:    " + stats.path("completed_in_history").asInt());

        JsonNode active = stats.path("active_agents");
        if (!active.isEmpty()) {
            System.out.println();
            for (JsonNode worker : active) {
                ConsoleOutput.worker(worker.path("type").asText(),
                        worker.path("agent_id").asText() + " " + worker.path("status").asText()
                                + " " + worker.path("action").asText("-"));
            }
        }
        return 0;
    }
}
