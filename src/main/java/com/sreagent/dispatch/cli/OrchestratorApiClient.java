package com.sreagent.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.function.BiPredicate;
import java.util.stream.Stream;

/**
 * HTTP client the CLI commands use to talk to a running orchestrator server.
 */
@Component
public class OrchestratorApiClient {

    private final String baseUrl;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    public OrchestratorApiClient(@Value("${sreagent.cli.server-url:http://localhost:8080}") String baseUrl,
                                 ObjectMapper objectMapper) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    /** Synchronous query; waits for the formatted reply. */
    public JsonNode query(String message) {
        String body;
        try {
            body = objectMapper.writeValueAsString(Map.of("message", message));
        } catch (JsonProcessingException e) {
            throw new ApiClientException("Could not encode query", e);
        }
        return send(HttpRequest.newBuilder(uri("/api/v1/query"))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build());
    }

    public JsonNode catalog() {
        return get("/api/v1/workers");
    }

    public JsonNode activeWorkers() {
        return get("/api/v1/workers/active");
    }

    public JsonNode completedWorkers(int limit) {
        return get("/api/v1/workers/completed?limit=" + limit);
    }

    /**
     * @throws ApiClientException with {@link ApiClientException#isNotFound()} when the id is unknown
     */
    public JsonNode worker(String workerId) {
        return get("/api/v1/workers/" + URLEncoder.encode(workerId, StandardCharsets.UTF_8));
    }

    public JsonNode stats() {
        return get("/api/v1/workers/stats");
    }

    public JsonNode history() {
        return get("/api/v1/history");
    }

    /**
     * Component health. A 503 answer is returned like a 200 one, since its body carries
     * the component details.
     */
    public JsonNode health() {
        HttpRequest request = HttpRequest.newBuilder(uri("/api/v1/health")).GET().build();
        HttpResponse<String> response = execute(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() != 200 && response.statusCode() != 503) {
            throw new ApiClientException("Server returned HTTP " + response.statusCode(), response.statusCode());
        }
        return parse(response.body());
    }

    /**
     * Opens the live event stream and hands each frame to {@code onFrame} until the
     * stream ends or {@code onFrame} returns false.
     *
     * @param clientId stream id to register under, may be null
     * @param onFrame  receives the SSE event name and its data line
     */
    public void stream(String clientId, BiPredicate<String, JsonNode> onFrame) {
        String path = "/api/v1/stream" + (clientId != null
                ? "?client_id=" + URLEncoder.encode(clientId, StandardCharsets.UTF_8) : "");
        HttpRequest request = HttpRequest.newBuilder(uri(path))
                .header("Accept", "text/event-stream")
                .GET()
                .build();
        HttpResponse<Stream<String>> response = execute(request, HttpResponse.BodyHandlers.ofLines());
        if (response.statusCode() != 200) {
            throw new ApiClientException("Server returned HTTP " + response.statusCode(), response.statusCode());
        }

        String eventName = "message";
        try (Stream<String> lines = response.body()) {
            var it = lines.iterator();
            while (it.hasNext()) {
                String line = it.next();
                if (line.startsWith("event:")) {
                    eventName = line.substring(6).trim();
                } else if (line.startsWith("data:")) {
                    if (!onFrame.test(eventName, parse(line.substring(5).trim()))) {
                        return;
                    }
                    eventName = "message";
                }
            }
        }
    }

    private JsonNode get(String path) {
        return send(HttpRequest.newBuilder(uri(path)).GET().build());
    }

    private JsonNode send(HttpRequest request) {
        HttpResponse<String> response = execute(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() / 100 != 2) {
            throw new ApiClientException("Server returned HTTP " + response.statusCode()
                    + errorSuffix(response.body()), response.statusCode());
        }
        return parse(response.body());
    }

    private <T> HttpResponse<T> execute(HttpRequest request, HttpResponse.BodyHandler<T> handler) {
        try {
            return httpClient.send(request, handler);
        } catch (ConnectException e) {
            throw new ApiClientException("Cannot connect to orchestrator server at " + baseUrl, e);
        } catch (IOException e) {
            throw new ApiClientException("Request to " + request.uri() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ApiClientException("Request to " + request.uri() + " interrupted", e);
        }
    }

    private JsonNode parse(String body) {
        try {
            return objectMapper.readTree(body == null || body.isBlank() ? "{}" : body);
        } catch (JsonProcessingException e) {
            throw new ApiClientException("Server returned invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private String errorSuffix(String body) {
        try {
            JsonNode node = objectMapper.readTree(body);
            return node.hasNonNull("error") ? ": " + node.get("error").asText() : "";
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return "";
        }
    }

    private URI uri(String path) {
        return URI.create(baseUrl + path);
    }
}
