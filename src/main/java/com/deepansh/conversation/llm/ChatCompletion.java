package com.deepansh.conversation.llm;

import com.deepansh.conversation.model.ToolCall;
import com.deepansh.conversation.model.Usage;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Raw provider reply, before it is mapped onto a response variant.
 */
@Value
@Builder
public class ChatCompletion {

    String content;

    String finishReason;

    @Builder.Default
    Usage usage = Usage.empty();

    @Builder.Default
    List<ToolCall> toolCalls = List.of();

    /** Set by providers that decode structured output themselves; null means "parse the content". */
    Object structuredValue;

    /** Provider exchange id, if the vendor issues one. */
    String responseId;

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }
}
