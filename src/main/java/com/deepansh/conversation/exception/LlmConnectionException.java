package com.deepansh.conversation.exception;

import lombok.Getter;

/**
 * Failure reported by the provider collaborator: network error, timeout
 * or a non-2xx API answer. Forwarded to the caller as-is.
 */
@Getter
public class LlmConnectionException extends LlmException {

    /** HTTP status of the provider answer, or -1 when no answer was received. */
    private final int statusCode;

    public LlmConnectionException(String message) {
        this(message, -1, null);
    }

    public LlmConnectionException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public LlmConnectionException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }
}
