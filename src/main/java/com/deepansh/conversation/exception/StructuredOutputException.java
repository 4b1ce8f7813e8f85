package com.deepansh.conversation.exception;

import com.deepansh.conversation.model.Usage;
import lombok.Getter;

/**
 * The model's reply could not be turned into a structured value.
 * The raw text is kept so the caller can inspect or repair it without
 * re-issuing the network call.
 */
@Getter
public class StructuredOutputException extends LlmException {

    /** Unparsed content as returned by the provider; null when no call was made. */
    private final String rawContent;

    /** Token usage of the failed exchange; null when no call was made. */
    private final Usage usage;

    public StructuredOutputException(String message) {
        this(message, null, null, null);
    }

    public StructuredOutputException(String message, String rawContent, Usage usage, Throwable cause) {
        super(message, cause);
        this.rawContent = rawContent;
        this.usage = usage;
    }
}
