package com.deepansh.conversation.model;

import com.deepansh.conversation.exception.StructuredOutputException;
import com.deepansh.conversation.util.JsonUtils;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Completion whose content was parsed into a JSON value.
 * {@link #getContent()} keeps the raw text the value was parsed from.
 */
@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@JsonPropertyOrder({"content", "structured", "usage", "model", "finish_reason"})
public class StructuredResponse extends Response {

    /** Parsed value: a Map for JSON objects, a List for arrays, or a scalar. */
    private final Object structured;

    @JsonCreator
    public StructuredResponse(@JsonProperty("content") String content,
                              @JsonProperty("structured") Object structured,
                              @JsonProperty("usage") Usage usage,
                              @JsonProperty("model") String model,
                              @JsonProperty("finish_reason") String finishReason) {
        super(content, usage, model, finishReason);
        this.structured = structured;
    }

    /** Binds the structured value onto a caller type, e.g. a record mirroring the schema. */
    public <T> T getStructuredAs(Class<T> type) {
        try {
            return JsonUtils.objectMapper().convertValue(structured, type);
        } catch (IllegalArgumentException e) {
            throw new StructuredOutputException("Structured value does not fit " + type.getSimpleName()
                    + ": " + e.getMessage(), getContent(), getUsage(), e);
        }
    }

    public static StructuredResponse fromJson(String json) {
        return JsonUtils.fromJson(json, StructuredResponse.class);
    }
}
