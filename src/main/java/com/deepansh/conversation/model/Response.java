package com.deepansh.conversation.model;

import com.deepansh.conversation.util.JsonUtils;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;

/**
 * Outcome of a plain completion. Read-only to the caller.
 */
@Getter
@EqualsAndHashCode
@ToString
@JsonPropertyOrder({"content", "usage", "model", "finish_reason"})
public class Response {

    public static final String DEFAULT_FINISH_REASON = "stop";

    private final String content;

    private final Usage usage;

    private final String model;

    @JsonProperty("finish_reason")
    private final String finishReason;

    @JsonCreator
    public Response(@JsonProperty("content") String content,
                    @JsonProperty("usage") Usage usage,
                    @JsonProperty("model") String model,
                    @JsonProperty("finish_reason") String finishReason) {
        this.content = content != null ? content : "";
        this.usage = usage != null ? usage : Usage.empty();
        this.model = model;
        this.finishReason = finishReason != null ? finishReason : DEFAULT_FINISH_REASON;
    }

    public static Response fromJson(String json) {
        return JsonUtils.fromJson(json, Response.class);
    }

    public Map<String, Object> toMap() {
        return JsonUtils.toMap(this);
    }

    public String toJson() {
        return JsonUtils.toJson(this);
    }
}
