package com.sreagent.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: sre-agent inspect &lt;worker-id&gt;
 * <p>
 * Shows one worker's registry record: status, identity proof, timings and its
 * event audit trail. Works for workers in cooldown and for destroyed ones still in
 * the completed history.
 */
@Command(name = "inspect", mixinStandardHelpOptions = true, description = "Inspect a worker's record")
@Component
public class InspectCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Worker ID")
    private String workerId;

    private final OrchestratorApiClient apiClient;

    public InspectCommand(OrchestratorApiClient apiClient) {
        this.apiClient = apiClient;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        JsonNode worker;
        try {
            worker = apiClient.worker(workerId);
        } catch (ApiClientException e) {
            ConsoleOutput.error(e.isNotFound() ? "Worker not found: " + workerId : e.getMessage());
            return 1;
        }

        System.out.println();
        System.out.println("WORKER " + worker.path("agent_id").asText(workerId));
        System.out.println("──────────────────────────────────");
        System.out.println("  Kind:        " + worker.path("agent_type").asText("-"));
        System.out.println("  Status:      " + worker.path("status").asText("-"));
        System.out.println("  Action:      " + worker.path("action").asText("-"));
        System.out.println("  Created:     " + worker.path("created_at").asText("-"));
        System.out.println("  Completed:   " + text(worker, "completed_at"));
        System.out.println("  Result:      " + text(worker, "result_status"));
        if (worker.hasNonNull("execution_seconds")) {
            System.out.println("  Execution:   " + ConsoleOutput.formatSeconds(worker.get("execution_seconds").asDouble()));
        }
        if (worker.hasNonNull("duration_seconds")) {
            System.out.println("  Lifetime:    " + ConsoleOutput.formatSeconds(worker.get("duration_seconds").asDouble()));
        }

        JsonNode proof = worker.path("identity_proof");
        if (!proof.isMissingNode() && !proof.isNull()) {
            System.out.println();
            System.out.println("  Identity proof:");
            proof.fields().forEachRemaining(field ->
                    System.out.println("    " + field.getKey() + ": " + field.getValue().asText()));
        }

        JsonNode events = worker.path("events");
        System.out.println();
        System.out.println("  Events (" + events.size() + "):");
        for (JsonNode event : events) {
            String detail = event.path("detail").asText("");
            System.out.println("    " + event.path("timestamp").asText() + "  "
                    + String.format("%-10s", event.path("status").asText()) + " "
                    + event.path("step").asText()
                    + (detail.isEmpty() ? "" : " | " + detail));
        }
        return 0;
    }

    private static String text(JsonNode node, String field) {
        return node.hasNonNull(field) ? node.get(field).asText() : "-";
    }
}
