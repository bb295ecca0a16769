package com.sreagent.core.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.sreagent.core.model.WorkerKind;

import java.util.Map;

/**
 * Turns a worker's raw result into a human-readable (markdown) reply.
 */
public interface ResponseFormatter {

    int RAW_LIMIT = 2000;

    /**
     * @throws RuntimeException when formatting fails; callers fall back to {@link #renderRaw}
     */
    String format(WorkerKind kind, String action, Map<String, Object> rawResult);

    /**
     * Plain rendering of a raw result as a fenced JSON block, truncated to
     * {@value #RAW_LIMIT} characters.
     */
    static String renderRaw(ObjectMapper objectMapper, Map<String, Object> rawResult) {
        String json;
        try {
            json = objectMapper.copy()
                    .enable(SerializationFeature.INDENT_OUTPUT)
                    .writeValueAsString(rawResult);
        } catch (JsonProcessingException e) {
            json = String.valueOf(rawResult);
        }
        if (json.length() > RAW_LIMIT) {
            json = json.substring(0, RAW_LIMIT);
        }
        return "**Raw Result:**\n```json\n" + json + "\n```";
    }
}
