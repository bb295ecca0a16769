package com.sreagent.dispatch.cli;

/**
 * Thrown when the orchestrator server cannot be reached or answers with an error status.
 */
public class ApiClientException extends RuntimeException {

    private final int statusCode;

    public ApiClientException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public ApiClientException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /** HTTP status, or -1 when no response was received. */
    public int getStatusCode() {
        return statusCode;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }
}
