package com.sreagent.core.llm;

import com.sreagent.core.model.Intent;
import com.sreagent.core.model.WorkerKind;
import com.sreagent.core.worker.WorkerBehavior;
import com.sreagent.core.worker.WorkerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Classifies operator utterances with the LLM.
 * <p>
 * The system prompt lists every worker kind with its actions, so the catalog and the
 * prompt cannot drift apart.
 */
@Component
public class LlmIntentClassifier implements IntentClassifier {

    private static final Logger log = LoggerFactory.getLogger(LlmIntentClassifier.class);

    static final String SYSTEM_PROMPT = buildSystemPrompt();

    private final LlmService llmService;

    public LlmIntentClassifier(LlmService llmService) {
        this.llmService = llmService;
    }

    @Override
    public Intent classify(String utterance) {
        Intent intent = llmService.structuredCall(SYSTEM_PROMPT, utterance, Intent.class);
        if (intent == null || intent.workerKind() == null || intent.workerKind().isBlank()) {
            throw new LlmParseException("Classifier response names no worker kind");
        }
        log.info("Classified '{}' -> {} / {}", abbreviate(utterance), intent.workerKind(), intent.action());
        return intent;
    }

    private static String buildSystemPrompt() {
        var sb = new StringBuilder();
        sb.append("""
                You are an SRE orchestrator for a production web application.
                Your job is to understand the operator's request and decide which specialized,
                short-lived worker to create and which action it should run.

                Available workers:
                """);
        int n = 1;
        for (WorkerKind kind : WorkerKind.values()) {
            WorkerBehavior behavior = WorkerFactory.behaviorFor(kind);
            sb.append(n++).append(". ").append(kind.wireName())
                    .append(" (").append(kind.description()).append("), actions: ")
                    .append(String.join(", ", behavior.supportedActions()))
                    .append('\n');
        }
        sb.append("""

                Respond with a JSON object with fields "agent" (one of the worker names above),
                "action" (one of that worker's actions), "params" (an object, possibly empty)
                and "reasoning" (one sentence explaining the choice).

                Examples:
                - "check logs for errors" -> {"agent": "log_worker", "action": "get_error_logs", "params": {"hours": 24, "limit": 100}, "reasoning": "The operator wants recent error logs"}
                - "is the app healthy?" -> {"agent": "health_worker", "action": "check_all", "params": {}, "reasoning": "The operator wants a full health check"}
                - "show me the SRE dashboard" -> {"agent": "dashboard_worker", "action": "get_dashboard", "params": {}, "reasoning": "The operator wants the golden signals"}
                - "start monitoring every 5 mins" -> {"agent": "monitor_worker", "action": "start", "params": {"interval_minutes": 5}, "reasoning": "The operator wants continuous monitoring"}
                - "restart the app" -> {"agent": "deployment_worker", "action": "restart_app", "params": {}, "reasoning": "The operator wants the application restarted"}

                Always respond with valid JSON only. No markdown, no extra text.
                """);
        return sb.toString();
    }

    private static String abbreviate(String text) {
        return text.length() > 80 ? text.substring(0, 80) + "..." : text;
    }
}
