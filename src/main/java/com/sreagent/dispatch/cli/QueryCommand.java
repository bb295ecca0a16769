package com.sreagent.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: sre-agent query "&lt;request&gt;"
 * <p>
 * Sends one operator request to the server and prints the formatted reply once the
 * worker has finished.
 */
@Command(name = "query", mixinStandardHelpOptions = true,
        description = "Send an operator request and print the reply")
@Component
public class QueryCommand implements Callable<Integer> {

    @Parameters(arity = "1..*", description = "The request, e.g. \"check health of all apps\"")
    private List<String> words;

    @Option(names = {"--raw"}, description = "Also print the raw worker result")
    private boolean raw;

    private final OrchestratorApiClient apiClient;

    public QueryCommand(OrchestratorApiClient apiClient) {
        this.apiClient = apiClient;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        String message = String.join(" ", words).trim();
        if (message.isEmpty()) {
            ConsoleOutput.error("Request must not be empty");
            return 2;
        }

        ConsoleOutput.info("Sending: " + message);
        JsonNode response;
        try {
            response = apiClient.query(message);
        } catch (ApiClientException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        JsonNode result = response.path("raw");
        ConsoleOutput.worker(response.path("worker_kind").asText("-"),
                response.path("action").asText("-") + " (session " + response.path("session_id").asText() + ")");
        String reasoning = response.path("reasoning").asText("");
        if (!reasoning.isEmpty()) {
            ConsoleOutput.info("Reasoning: " + reasoning);
        }
        System.out.println();
        System.out.println(response.path("result").asText(""));
        System.out.println();

        if (raw && !result.isMissingNode()) {
            System.out.println(result.toPrettyString());
        }

        String status = result.path("status").asText("");
        String workerId = result.path("agent_id").asText("-");
        if ("error".equals(status)) {
            ConsoleOutput.error("Worker " + workerId + " failed: " + result.path("error").asText("unknown error"));
            return 1;
        }
        ConsoleOutput.success("Worker " + workerId + " finished in "
                + ConsoleOutput.formatSeconds(result.path("duration_seconds").asDouble()));
        return 0;
    }
}
