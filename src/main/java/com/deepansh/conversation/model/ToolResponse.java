package com.deepansh.conversation.model;

import com.deepansh.conversation.util.JsonUtils;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Completion issued with tools on offer. Zero tool calls means the model answered directly.
 */
@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@JsonPropertyOrder({"content", "tool_calls", "usage", "model", "finish_reason", "response_id"})
public class ToolResponse extends Response {

    @JsonProperty("tool_calls")
    private final List<ToolCall> toolCalls;

    /** Provider exchange id; replayed as the assistant message id. */
    @JsonProperty("response_id")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private final String responseId;

    @JsonCreator
    public ToolResponse(@JsonProperty("content") String content,
                        @JsonProperty("tool_calls") List<ToolCall> toolCalls,
                        @JsonProperty("usage") Usage usage,
                        @JsonProperty("model") String model,
                        @JsonProperty("finish_reason") String finishReason,
                        @JsonProperty("response_id") String responseId) {
        super(content, usage, model, finishReason);
        this.toolCalls = toolCalls != null ? List.copyOf(toolCalls) : List.of();
        this.responseId = responseId;
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }

    @JsonIgnore
    public ToolCallState getState() {
        return hasToolCalls() ? ToolCallState.HAS_TOOL_CALLS : ToolCallState.TERMINAL;
    }

    public static ToolResponse fromJson(String json) {
        return JsonUtils.fromJson(json, ToolResponse.class);
    }
}
