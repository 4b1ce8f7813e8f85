package com.deepansh.conversation.exception;

/**
 * Root of every failure raised by the conversation layer.
 * Unchecked: callers decide where to recover, nothing is retried internally.
 */
public class LlmException extends RuntimeException {

    public LlmException(String message) {
        super(message);
    }

    public LlmException(String message, Throwable cause) {
        super(message, cause);
    }
}
