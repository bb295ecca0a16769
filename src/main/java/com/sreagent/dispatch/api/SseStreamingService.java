package com.sreagent.dispatch.api;

import com.sreagent.core.events.EventBroadcaster;
import com.sreagent.core.events.ProgressEvent;
import com.sreagent.core.metrics.OrchestratorMetrics;
import com.sreagent.core.model.ChatReply;
import com.sreagent.core.model.WorkerKind;
import com.sreagent.core.orchestrator.Requester;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Bridges {@link EventBroadcaster} subscriptions to {@link SseEmitter} instances, one per
 * connected client.
 * <p>
 * Every client sees every pipeline event ({@code pipeline_event}); chat replies
 * ({@code chat_response}) go only to the client that asked. An emitter that fails to
 * send is completed and its subscription is dropped by the broadcaster.
 * <p>
 * Heartbeats are sent as SSE comments every 30 seconds to keep idle connections open
 * through proxies.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    /** Default emitter timeout: 30 minutes. */
    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;

    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    private final EventBroadcaster broadcaster;
    private final OrchestratorMetrics metrics;
    private final long timeoutMs;

    private final ConcurrentHashMap<String, EmitterRegistration> registrations = new ConcurrentHashMap<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBroadcaster broadcaster, OrchestratorMetrics metrics) {
        this(broadcaster, metrics, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(EventBroadcaster broadcaster, OrchestratorMetrics metrics, long timeoutMs) {
        this.broadcaster = broadcaster;
        this.metrics = metrics;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(
                this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS,
                HEARTBEAT_INTERVAL_SECONDS,
                TimeUnit.SECONDS
        );
        log.info("SSE heartbeat scheduler started (interval={}s)", HEARTBEAT_INTERVAL_SECONDS);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("SSE heartbeat scheduler stopped");
    }

    void sendHeartbeats() {
        if (registrations.isEmpty()) {
            return;
        }
        log.debug("Sending heartbeat to {} active SSE emitters", registrations.size());
        for (EmitterRegistration registration : registrations.values()) {
            try {
                registration.emitter.send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException | IllegalStateException e) {
                // the emitter's own callbacks clean up
                log.debug("Heartbeat failed for client {}: {}", registration.clientId, e.getMessage());
            }
        }
    }

    /**
     * Creates an SSE emitter streaming all pipeline events plus the chat replies for
     * {@code clientId}. A client reconnecting with the same id replaces its old stream.
     *
     * @param clientId the client's id; a new one is generated when blank
     */
    public SseEmitter createEmitter(String clientId) {
        String id = clientId == null || clientId.isBlank() ? UUID.randomUUID().toString().substring(0, 8) : clientId;
        SseEmitter emitter = new SseEmitter(timeoutMs);

        EventBroadcaster.Subscription subscription = broadcaster.subscribe(event -> sendEvent(id, emitter, event));
        var registration = new EmitterRegistration(id, emitter, subscription);
        EmitterRegistration previous = registrations.put(id, registration);
        if (previous != null) {
            previous.subscription.unsubscribe();
            previous.emitter.complete();
        }

        emitter.onCompletion(() -> {
            log.debug("SSE emitter completed for client {}", id);
            cleanup(registration);
        });
        emitter.onTimeout(() -> {
            log.debug("SSE emitter timed out for client {}", id);
            cleanup(registration);
        });
        emitter.onError(ex -> {
            log.debug("SSE emitter error for client {}: {}", id, ex.getMessage());
            cleanup(registration);
        });

        Map<String, Object> welcome = new LinkedHashMap<>();
        welcome.put("message", "SRE orchestrator connected. Ask anything about your application.");
        welcome.put("client_id", id);
        welcome.put("agents", Arrays.stream(WorkerKind.values()).map(WorkerKind::wireName).toList());
        try {
            emitter.send(SseEmitter.event().name("connected").data(welcome));
        } catch (IOException e) {
            log.warn("Failed to send welcome to client {}: {}", id, e.getMessage());
        }

        log.info("SSE emitter created for client {} (timeout={}ms)", id, timeoutMs);
        return emitter;
    }

    /**
     * A requester delivering chat replies to {@code clientId}'s stream, if it is connected.
     */
    public Requester requesterFor(String clientId) {
        return reply -> sendReply(clientId, reply);
    }

    public boolean isConnected(String clientId) {
        return clientId != null && registrations.containsKey(clientId);
    }

    public int activeEmitterCount() {
        return registrations.size();
    }

    private void sendReply(String clientId, ChatReply reply) {
        EmitterRegistration registration = clientId != null ? registrations.get(clientId) : null;
        if (registration == null) {
            log.info("Client {} not connected, reply for session {} not delivered", clientId, reply.sessionId());
            return;
        }
        try {
            registration.emitter.send(SseEmitter.event().name("chat_response").data(reply));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to send chat response to client " + clientId, e);
        }
    }

    private void sendEvent(String clientId, SseEmitter emitter, ProgressEvent event) {
        try {
            emitter.send(SseEmitter.event().name("pipeline_event").data(event.toMap()));
        } catch (IOException | IllegalStateException e) {
            metrics.recordObserverDropped();
            emitter.completeWithError(e);
            throw new IllegalStateException("SSE delivery to client " + clientId + " failed: " + e.getMessage(), e);
        }
    }

    private void cleanup(EmitterRegistration registration) {
        registration.subscription.unsubscribe();
        registrations.remove(registration.clientId, registration);
        log.debug("Cleaned up SSE registration for client {}", registration.clientId);
    }

    private record EmitterRegistration(
            String clientId,
            SseEmitter emitter,
            EventBroadcaster.Subscription subscription
    ) {}
}
