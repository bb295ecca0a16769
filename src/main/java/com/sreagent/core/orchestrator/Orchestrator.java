package com.sreagent.core.orchestrator;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sreagent.core.events.EventBroadcaster;
import com.sreagent.core.events.EventPhase;
import com.sreagent.core.events.ProgressEvent;
import com.sreagent.core.llm.IntentClassifier;
import com.sreagent.core.llm.LlmParseException;
import com.sreagent.core.llm.ResponseFormatter;
import com.sreagent.core.logging.MdcContext;
import com.sreagent.core.metrics.OrchestratorMetrics;
import com.sreagent.core.model.ChatReply;
import com.sreagent.core.model.Intent;
import com.sreagent.core.model.QueryOutcome;
import com.sreagent.core.model.RunRecord;
import com.sreagent.core.model.WorkerKind;
import com.sreagent.core.model.WorkerRecord;
import com.sreagent.core.model.WorkerResult;
import com.sreagent.core.registry.LifecycleRegistry;
import com.sreagent.core.worker.Worker;
import com.sreagent.core.worker.WorkerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Per-utterance control loop.
 * <p>
 * For each operator utterance: classify it, create the matching worker, run it, keep it
 * inspectable for the cooldown window, format the result, reply to the requester and
 * record the run. Utterances are independent; any number may be in flight at once, and
 * all shared state is reached through the registry and the broadcaster.
 */
@Service
public class Orchestrator {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    private final LifecycleRegistry registry;
    private final WorkerFactory workerFactory;
    private final EventBroadcaster broadcaster;
    private final IntentClassifier classifier;
    private final ResponseFormatter formatter;
    private final CooldownScheduler cooldowns;
    private final RunHistory history;
    private final OrchestratorProperties properties;
    private final OrchestratorMetrics metrics;
    private final ObjectMapper objectMapper;
    private final ExecutorService executor;

    public Orchestrator(LifecycleRegistry registry,
                        WorkerFactory workerFactory,
                        EventBroadcaster broadcaster,
                        IntentClassifier classifier,
                        ResponseFormatter formatter,
                        CooldownScheduler cooldowns,
                        RunHistory history,
                        OrchestratorProperties properties,
                        OrchestratorMetrics metrics,
                        ObjectMapper objectMapper,
                        @Qualifier("orchestratorExecutor") ExecutorService executor) {
        this.registry = registry;
        this.workerFactory = workerFactory;
        this.broadcaster = broadcaster;
        this.classifier = classifier;
        this.formatter = formatter;
        this.cooldowns = cooldowns;
        this.history = history;
        this.properties = properties;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.executor = executor;
    }

    public String generateSessionId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Handles an utterance on the orchestrator pool.
     *
     * @return completes with the outcome once the reply has been delivered
     */
    public CompletableFuture<QueryOutcome> submit(String sessionId, String text, Requester requester) {
        return CompletableFuture.supplyAsync(() -> handle(sessionId, text, requester), executor)
                .whenComplete((outcome, error) -> {
                    if (error != null) {
                        log.error("[{}] Query handling failed: {}", sessionId, error.getMessage(), error);
                    }
                });
    }

    /**
     * Handles an utterance on the calling thread.
     * <p>
     * Returns once the reply has been delivered; the worker is still in cooldown at that
     * point and is destroyed later by the cooldown scheduler.
     *
     * @param sessionId id correlating the events of this utterance
     * @param text      the operator's utterance
     * @param requester receives the formatted reply
     */
    public QueryOutcome handle(String sessionId, String text, Requester requester) {
        MdcContext.setSession(sessionId);
        try {
            log.info("[{}] Query: {}", sessionId, text);
            announce(sessionId, "Analyzing query", EventPhase.RUNNING, abbreviate(text, 80));

            Routing routing = route(text);
            announce(sessionId, "Intent classified", EventPhase.COMPLETED,
                    "Worker: " + routing.kind().wireName() + " | Action: " + routing.action()
                            + " | " + routing.reasoning());

            Worker worker = workerFactory.create(routing.kind(), broadcaster::broadcast);
            metrics.recordWorkerCreated(routing.kind().wireName());

            WorkerResult result = null;
            try {
                result = worker.run(routing.action(), routing.params());
            } finally {
                holdForInspection(worker, result != null ? result
                        : WorkerResult.failure(worker.workerId(), routing.kind(), routing.action(), 0.0,
                                "Worker run aborted"));
            }
            metrics.recordWorkerRun(routing.kind().wireName(), result.status().wireName(),
                    Duration.ofNanos((long) (result.durationSeconds() * 1_000_000_000L)));

            String formatted = format(worker, result);
            deliver(requester, new ChatReply(sessionId, formatted, routing.kind(), worker.workerId(), Instant.now()));

            history.append(new RunRecord(sessionId, text, routing.kind(), result.action(), worker.workerId(),
                    result.status().wireName(), result.durationSeconds(), Instant.now()));

            announce(sessionId, "Request complete", EventPhase.COMPLETED,
                    String.format("Session %s | %.1fs", sessionId, result.durationSeconds()));

            return new QueryOutcome(sessionId, routing.kind(), result.action(), routing.reasoning(),
                    routing.fallback(), result, formatted, Instant.now());
        } finally {
            MdcContext.clear();
        }
    }

    private Routing route(String text) {
        Intent intent;
        try {
            intent = classifier.classify(text);
        } catch (RuntimeException e) {
            log.warn("Intent classification failed, using default worker: {}", e.getMessage());
            if (e instanceof LlmParseException parse && parse.getExcerpt() != null) {
                log.debug("Unparseable classifier reply: {}", parse.getExcerpt());
            }
            metrics.recordClassificationFallback("classifier_error");
            return fallbackRouting("Classifier error: " + e.getMessage());
        }
        if (intent == null) {
            log.warn("Classifier returned no intent, using default worker");
            metrics.recordClassificationFallback("no_intent");
            return fallbackRouting("Classifier returned no intent");
        }
        Optional<WorkerKind> kind = WorkerKind.fromName(intent.workerKind());
        if (kind.isEmpty()) {
            log.warn("Classifier named unknown worker kind '{}', using default worker", intent.workerKind());
            metrics.recordClassificationFallback("unknown_kind");
            return fallbackRouting("Unknown worker kind '" + intent.workerKind() + "'");
        }
        return new Routing(kind.get(), intent.action(), intent.params(), intent.reasoning(), false);
    }

    private Routing fallbackRouting(String cause) {
        WorkerKind kind = WorkerKind.fromName(properties.getDefaultKind()).orElse(WorkerKind.HEALTH);
        String action = properties.getDefaultAction();
        return new Routing(kind, action, Map.of(),
                cause + ", defaulting to " + kind.wireName() + "/" + action, true);
    }

    private void holdForInspection(Worker worker, WorkerResult result) {
        Duration cooldown = properties.getCooldown();
        String workerId = worker.workerId();
        broadcaster.broadcast(ProgressEvent.of("Worker available for inspection", EventPhase.COMPLETED,
                "Inspect worker " + workerId + " before auto-destruction",
                workerId, worker.kind().wireName(),
                Map.of("inspect_url", "/api/v1/workers/" + workerId,
                        "cooldown_remaining", cooldown.toSeconds())));
        try {
            cooldowns.schedule(worker, cooldown, () -> destroy(worker, result, cooldown));
        } catch (RejectedExecutionException e) {
            log.warn("Cooldown unavailable for {}, destroying immediately", workerId);
            destroy(worker, result, Duration.ZERO);
        }
    }

    private void destroy(Worker worker, WorkerResult result, Duration cooldown) {
        String kind = worker.kind().wireName();
        MdcContext.setWorker(worker.workerId(), kind);
        try {
            Optional<WorkerRecord> finalized = registry.deregister(worker.workerId(), worker.identityProof(), result);
            if (finalized.isPresent()) {
                metrics.recordWorkerDestroyed(kind);
            }
            broadcaster.broadcast(ProgressEvent.of("Destroying " + worker.kind().description(), EventPhase.COMPLETED,
                    "Worker " + worker.workerId() + " terminated after " + cooldown.toSeconds() + "s cooldown",
                    worker.workerId(), kind));
            log.info("Worker {} destroyed after {}s cooldown", worker.workerId(), cooldown.toSeconds());
        } finally {
            MdcContext.clearWorker();
        }
    }

    private String format(Worker worker, WorkerResult result) {
        broadcaster.broadcast(ProgressEvent.of("Formatting response", EventPhase.RUNNING,
                "Summarizing the results", worker.workerId(), worker.kind().wireName()));
        String formatted;
        try {
            formatted = formatter.format(worker.kind(), result.action(), result.formatterPayload());
            if (formatted == null || formatted.isBlank()) {
                throw new IllegalStateException("formatter returned no text");
            }
        } catch (RuntimeException e) {
            log.warn("Response formatting failed for {}, sending raw result: {}", worker.workerId(), e.getMessage());
            metrics.recordFormatterFallback();
            formatted = ResponseFormatter.renderRaw(objectMapper, result.formatterPayload());
        }
        broadcaster.broadcast(ProgressEvent.of("Response formatted", EventPhase.COMPLETED,
                formatted.length() + " chars", worker.workerId(), worker.kind().wireName()));
        return formatted;
    }

    private void deliver(Requester requester, ChatReply reply) {
        try {
            requester.reply(reply);
        } catch (RuntimeException e) {
            log.warn("[{}] Failed to deliver reply: {}", reply.sessionId(), e.getMessage());
        }
    }

    private void announce(String sessionId, String label, EventPhase phase, String detail) {
        broadcaster.broadcast(ProgressEvent.of(label, phase, detail, sessionId, ProgressEvent.ORCHESTRATOR));
    }

    private static String abbreviate(String text, int max) {
        return text.length() > max ? text.substring(0, max) : text;
    }

    private record Routing(WorkerKind kind, String action, Map<String, Object> params,
                           String reasoning, boolean fallback) {}
}
