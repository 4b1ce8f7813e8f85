package com.deepansh.conversation.model;

import com.deepansh.conversation.exception.ValidationException;
import com.deepansh.conversation.util.JsonUtils;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;

/**
 * Token accounting for one exchange.
 * The provider-reported total is authoritative; the sum is only a fallback when it is absent.
 */
@Getter
@EqualsAndHashCode
@ToString
@JsonPropertyOrder({"prompt_tokens", "output_tokens", "total_tokens"})
public final class Usage {

    private static final Usage EMPTY = new Usage(0, 0, 0);

    @JsonProperty("prompt_tokens")
    private final int promptTokens;

    @JsonProperty("output_tokens")
    private final int outputTokens;

    @JsonProperty("total_tokens")
    private final int totalTokens;

    private Usage(int promptTokens, int outputTokens, int totalTokens) {
        this.promptTokens = promptTokens;
        this.outputTokens = outputTokens;
        this.totalTokens = totalTokens;
    }

    /**
     * @param totalTokens provider-reported total, or null to derive it from the two counts
     */
    @JsonCreator
    public static Usage of(@JsonProperty("prompt_tokens") int promptTokens,
                           @JsonProperty("output_tokens") int outputTokens,
                           @JsonProperty("total_tokens") Integer totalTokens) {
        if (promptTokens < 0 || outputTokens < 0) {
            throw new ValidationException(
                    "Token counts must be >= 0 (prompt=" + promptTokens + ", output=" + outputTokens + ")");
        }
        if (totalTokens != null && totalTokens < 0) {
            throw new ValidationException("total_tokens must be >= 0 but was " + totalTokens);
        }
        int total = totalTokens != null ? totalTokens : promptTokens + outputTokens;
        return new Usage(promptTokens, outputTokens, total);
    }

    public static Usage of(int promptTokens, int outputTokens) {
        return of(promptTokens, outputTokens, null);
    }

    public static Usage empty() {
        return EMPTY;
    }

    public static Usage fromJson(String json) {
        return JsonUtils.fromJson(json, Usage.class);
    }

    public Map<String, Object> toMap() {
        return JsonUtils.toMap(this);
    }

    public String toJson() {
        return JsonUtils.toJson(this);
    }
}
