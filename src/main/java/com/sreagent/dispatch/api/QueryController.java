package com.sreagent.dispatch.api;

import com.sreagent.core.model.QueryOutcome;
import com.sreagent.core.orchestrator.Orchestrator;
import com.sreagent.core.orchestrator.Requester;
import com.sreagent.core.orchestrator.RunHistory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller for operator queries and the live event stream.
 */
@RestController
@RequestMapping("/api/v1")
public class QueryController {

    private static final Logger log = LoggerFactory.getLogger(QueryController.class);

    static final int HISTORY_LIMIT = 50;

    private final Orchestrator orchestrator;
    private final SseStreamingService sseStreamingService;
    private final RunHistory runHistory;

    public QueryController(Orchestrator orchestrator,
                           SseStreamingService sseStreamingService,
                           RunHistory runHistory) {
        this.orchestrator = orchestrator;
        this.sseStreamingService = sseStreamingService;
        this.runHistory = runHistory;
    }

    /**
     * POST /api/v1/queries: Submit a query. Runs asynchronously; progress is streamed to
     * every client and the reply is sent as {@code chat_response} to {@code client_id}.
     */
    @PostMapping("/queries")
    public ResponseEntity<Map<String, String>> submitQuery(@RequestBody QueryRequest request) {
        if (request.message() == null || request.message().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "message is required"));
        }

        String sessionId = orchestrator.generateSessionId();
        Requester requester = request.clientId() != null
                ? sseStreamingService.requesterFor(request.clientId())
                : Requester.NONE;
        if (request.clientId() != null && !sseStreamingService.isConnected(request.clientId())) {
            log.info("Query {} submitted for client {} which has no open stream", sessionId, request.clientId());
        }

        orchestrator.submit(sessionId, request.message().trim(), requester);
        log.info("Accepted query {}", sessionId);

        Map<String, String> body = new LinkedHashMap<>();
        body.put("session_id", sessionId);
        body.put("status", "accepted");
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
    }

    /**
     * POST /api/v1/query: Handle a query synchronously, for callers without a stream.
     */
    @PostMapping("/query")
    public ResponseEntity<?> query(@RequestBody QueryRequest request) {
        if (request.message() == null || request.message().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "message is required"));
        }
        QueryOutcome outcome = orchestrator.handle(orchestrator.generateSessionId(),
                request.message().trim(), Requester.NONE);
        return ResponseEntity.ok(QueryResponse.from(outcome));
    }

    /**
     * GET /api/v1/stream: SSE stream of pipeline events and this client's replies.
     */
    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@RequestParam(name = "client_id", required = false) String clientId) {
        return sseStreamingService.createEmitter(clientId);
    }

    /**
     * GET /api/v1/history: The most recent runs, oldest first.
     */
    @GetMapping("/history")
    public Map<String, Object> history() {
        return Map.of("history", runHistory.recent(HISTORY_LIMIT));
    }
}
