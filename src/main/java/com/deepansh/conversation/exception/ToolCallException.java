package com.deepansh.conversation.exception;

import com.deepansh.conversation.model.Usage;
import lombok.Getter;

/**
 * Tool-calling protocol violation: the model named a tool that was never offered,
 * or the conversation breaks the replay-then-results ordering.
 */
@Getter
public class ToolCallException extends LlmException {

    /** Usage of the exchange that produced the offending reply, if one was received. */
    private final Usage usage;

    public ToolCallException(String message) {
        this(message, (Usage) null);
    }

    public ToolCallException(String message, Usage usage) {
        super(message);
        this.usage = usage;
    }

    public ToolCallException(String message, Throwable cause) {
        super(message, cause);
        this.usage = null;
    }
}
