package com.sreagent.core.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.sreagent.core.model.WorkerKind;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Formats raw worker results into a markdown SRE report with the LLM.
 */
@Component
public class LlmResponseFormatter implements ResponseFormatter {

    static final int PAYLOAD_LIMIT = 4000;

    static final String SYSTEM_PROMPT = """
            You are an SRE assistant presenting results to a human operator.
            Format the data into a clear, concise, human-readable response using markdown.
            Include relevant metrics, timestamps and status indicators.
            For logs, highlight errors and warnings.
            For dashboards, present the data as organized tables.
            For health checks, give a clear healthy/unhealthy verdict.
            Keep it professional but easy to scan quickly.
            If there are errors, suggest potential actions.
            """;

    private final LlmService llmService;
    private final ObjectMapper prettyMapper;

    public LlmResponseFormatter(LlmService llmService, ObjectMapper objectMapper) {
        this.llmService = llmService;
        this.prettyMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public String format(WorkerKind kind, String action, Map<String, Object> rawResult) {
        String userPrompt = "Worker: " + kind.wireName() + "\n"
                + "Action: " + action + "\n"
                + "Raw Data:\n```json\n" + payload(rawResult) + "\n```\n\n"
                + "Format this into a clear SRE report.";
        return llmService.textCall(SYSTEM_PROMPT, userPrompt);
    }

    private String payload(Map<String, Object> rawResult) {
        String json;
        try {
            json = prettyMapper.writeValueAsString(rawResult);
        } catch (JsonProcessingException e) {
            json = String.valueOf(rawResult);
        }
        return json.length() > PAYLOAD_LIMIT ? json.substring(0, PAYLOAD_LIMIT) : json;
    }
}
