package com.sreagent.core.llm;

/**
 * Thrown when model output cannot be turned into the expected structure, e.g. a
 * classifier reply that is not JSON or names no worker kind.
 */
public class LlmParseException extends RuntimeException {

    private static final int MAX_EXCERPT = 200;

    private final String excerpt;

    public LlmParseException(String message) {
        super(message);
        this.excerpt = null;
    }

    /**
     * @param rawContent the unparseable reply; only a short excerpt is kept
     */
    public LlmParseException(String message, String rawContent, Throwable cause) {
        super(message, cause);
        this.excerpt = rawContent == null || rawContent.length() <= MAX_EXCERPT
                ? rawContent
                : rawContent.substring(0, MAX_EXCERPT) + "...";
    }

    /** Start of the reply that failed to parse, or null when not captured. */
    public String getExcerpt() {
        return excerpt;
    }
}
