package com.sreagent.core.llm;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Wraps Spring AI's {@link ChatClient} for the two kinds of call the orchestrator makes:
 * structured (typed) output for intent classification, and free text for formatting
 * results.
 * <p>
 * Structured calls use {@link BeanOutputConverter} to generate a JSON schema from the
 * target Java class, append format instructions to the user prompt, and deserialize
 * the LLM's JSON response into the requested type.
 */
@Service
public class LlmService {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private final ChatClient chatClient;
    private final ObjectMapper lenientMapper;

    public LlmService(ChatClient.Builder builder,
                      @Value("${spring.ai.openai.base-url:NOT_SET}") String baseUrl) {
        this.chatClient = builder.build();
        this.lenientMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true)
                .registerModule(new ParameterNamesModule());
        log.info("LlmService initialized, OpenAI base-url: {}", baseUrl);
    }

    /**
     * Sends a system + user prompt to the LLM and returns the response
     * deserialized into the given {@code outputType}.
     *
     * @param systemPrompt instructions for the LLM's role / behaviour
     * @param userPrompt   the operator's text
     * @param outputType   the Java class (record or POJO) to deserialize into
     * @param <T>          target type
     * @return an instance of {@code T} populated from the LLM's JSON response
     * @throws LlmEmptyResponseException when the model returns no content
     * @throws LlmParseException         when the content is not valid JSON for {@code outputType}
     */
    public <T> T structuredCall(String systemPrompt, String userPrompt, Class<T> outputType) {
        log.info("LLM call started -> {}", outputType.getSimpleName());
        long start = System.currentTimeMillis();
        var converter = new BeanOutputConverter<>(outputType);
        String response = chatClient.prompt()
                .system(systemPrompt)
                .user(userPrompt + "\n\n" + converter.getFormat())
                .call()
                .content();
        long elapsed = System.currentTimeMillis() - start;
        log.info("LLM call complete -> {} ({}s)", outputType.getSimpleName(), String.format("%.1f", elapsed / 1000.0));
        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException(outputType.getSimpleName());
        }
        try {
            return converter.convert(response);
        } catch (RuntimeException e) {
            log.warn("Failed to parse LLM response to {}: {}", outputType.getSimpleName(), e.getMessage());
            log.debug("Raw LLM response: {}", response);
            return parseWithJackson(response, outputType);
        }
    }

    /**
     * Sends a system + user prompt and returns the model's text, trimmed.
     *
     * @throws LlmEmptyResponseException when the model returns no content
     */
    public String textCall(String systemPrompt, String userPrompt) {
        long start = System.currentTimeMillis();
        String response = chatClient.prompt()
                .system(systemPrompt)
                .user(userPrompt)
                .call()
                .content();
        log.info("LLM text call complete ({}s)", String.format("%.1f", (System.currentTimeMillis() - start) / 1000.0));
        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("text");
        }
        return response.trim();
    }

    /**
     * Fallback JSON parsing with lenient settings, after stripping markdown fences.
     */
    <T> T parseWithJackson(String json, Class<T> outputType) {
        try {
            T result = lenientMapper.readValue(stripCodeFence(json), outputType);
            log.info("Jackson fallback parsing succeeded for {}", outputType.getSimpleName());
            return result;
        } catch (Exception e) {
            log.error("Jackson fallback parsing FAILED for {}: {}", outputType.getSimpleName(), e.getMessage());
            throw new LlmParseException("Failed to parse LLM response to " + outputType.getSimpleName()
                    + ": " + e.getMessage(), json, e);
        }
    }

    static String stripCodeFence(String text) {
        String cleaned = text.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        return cleaned.trim();
    }
}
