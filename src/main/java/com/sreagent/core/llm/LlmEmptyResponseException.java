package com.sreagent.core.llm;

/**
 * Thrown when the model answers a classification or formatting call with no content.
 */
public class LlmEmptyResponseException extends RuntimeException {

    private final String expected;

    /**
     * @param expected what the call was supposed to produce, e.g. {@code Intent} or {@code text}
     */
    public LlmEmptyResponseException(String expected) {
        super("LLM returned empty content for " + expected);
        this.expected = expected;
    }

    public String getExpected() {
        return expected;
    }
}
