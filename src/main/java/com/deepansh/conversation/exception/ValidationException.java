package com.deepansh.conversation.exception;

/**
 * Malformed input: bad tool definition, out-of-range request option,
 * invalid message shape or an unparseable model spec.
 */
public class ValidationException extends LlmException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
