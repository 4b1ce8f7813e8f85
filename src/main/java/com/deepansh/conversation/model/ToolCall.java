package com.deepansh.conversation.model;

import com.deepansh.conversation.exception.ValidationException;
import com.deepansh.conversation.util.JsonUtils;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.Map;

/**
 * A model-issued request to invoke one of the offered tools.
 *
 * Only produced by parsing a provider reply (or re-reading a serialized response).
 * The arguments are exposed as-is; they are NOT checked against the tool's parameter schema.
 */
@Getter
@EqualsAndHashCode
@ToString
@JsonPropertyOrder({"id", "name", "arguments"})
public final class ToolCall {

    /** Provider-issued id; must be echoed back in the tool result message */
    private final String id;

    private final String name;

    private final Map<String, Object> arguments;

    private ToolCall(String id, String name, Map<String, Object> arguments) {
        this.id = id;
        this.name = name;
        this.arguments = arguments;
    }

    @JsonCreator
    public static ToolCall of(@JsonProperty("id") String id,
                              @JsonProperty("name") String name,
                              @JsonProperty("arguments") Map<String, ?> arguments) {
        if (id == null || id.isBlank()) {
            throw new ValidationException("Tool call must have a non-blank 'id'");
        }
        if (name == null || name.isBlank()) {
            throw new ValidationException("Tool call '" + id + "' must have a non-blank 'name'");
        }
        Map<String, Object> args = arguments == null ? Map.of() : JsonUtils.copyOf(arguments);
        return new ToolCall(id, name, Collections.unmodifiableMap(args));
    }

    /** Arguments re-encoded as a JSON object string, the form most vendor APIs expect. */
    public String argumentsAsJson() {
        return JsonUtils.toJson(arguments);
    }

    public static ToolCall fromJson(String json) {
        return JsonUtils.fromJson(json, ToolCall.class);
    }

    public Map<String, Object> toMap() {
        return JsonUtils.toMap(this);
    }

    public String toJson() {
        return JsonUtils.toJson(this);
    }
}
