package com.deepansh.conversation.llm;

import com.deepansh.conversation.model.Message;
import com.deepansh.conversation.model.RequestConfig;
import com.deepansh.conversation.tool.ToolDefinition;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Everything a provider needs for one exchange.
 */
@Value
@Builder
public class ChatCompletionRequest {

    /** Vendor model id, without the provider prefix. */
    String model;

    List<Message> messages;

    @Builder.Default
    RequestConfig config = RequestConfig.empty();

    /** Empty when no tools are offered. */
    @Builder.Default
    List<ToolDefinition> tools = List.of();

    /** Null for free-text completions. */
    ResponseFormat responseFormat;

    /** JSON Schema for {@link ResponseFormat#JSON_SCHEMA}; null otherwise. */
    Map<String, Object> schema;

    public boolean hasTools() {
        return tools != null && !tools.isEmpty();
    }
}
