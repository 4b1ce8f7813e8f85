package com.deepansh.conversation.model;

import com.deepansh.conversation.exception.ValidationException;
import com.deepansh.conversation.util.JsonUtils;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * One immutable turn of a conversation.
 *
 * The role is the variant tag and decides which optional fields may be present:
 * <ul>
 *   <li>{@code system}, {@code user}: content only</li>
 *   <li>{@code assistant}: content, optionally the provider exchange {@code id} and the {@code tool_calls}
 *       it requested. Those calls must be echoed back verbatim before any tool result, otherwise
 *       providers reject the follow-up request.</li>
 *   <li>{@code tool}: content plus the mandatory {@code tool_call_id} it answers</li>
 * </ul>
 */
@Getter
@EqualsAndHashCode
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"role", "content", "tool_calls", "id", "tool_call_id"})
public final class Message {

    public enum Role {
        system, user, assistant, tool;

        public static Role parse(String value) {
            if (value == null || value.isBlank()) {
                throw new ValidationException("Message must have a 'role' field");
            }
            try {
                return Role.valueOf(value.trim().toLowerCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new ValidationException("Invalid message role: " + value
                        + " (expected one of " + Arrays.toString(values()) + ")");
            }
        }
    }

    private final Role role;

    private final String content;

    /** Present only on assistant turns that requested tools. */
    @JsonProperty("tool_calls")
    private final List<ToolCall> toolCalls;

    /** Provider-assigned exchange id, kept on replayed assistant turns. */
    private final String id;

    /** Present iff role = tool: links back to the assistant's tool call. */
    @JsonProperty("tool_call_id")
    private final String toolCallId;

    private Message(Role role, String content, List<ToolCall> toolCalls, String id, String toolCallId) {
        this.role = role;
        this.content = content;
        this.toolCalls = toolCalls;
        this.id = id;
        this.toolCallId = toolCallId;
    }

    public static Message system(String content) {
        return of(Role.system, content, null, null, null);
    }

    public static Message user(String content) {
        return of(Role.user, content, null, null, null);
    }

    public static Message assistant(String content) {
        return of(Role.assistant, content, null, null, null);
    }

    public static Message tool(String toolCallId, String result) {
        return of(Role.tool, result, null, null, toolCallId);
    }

    /**
     * Rebuilds the assistant turn of a tool-calling reply, keeping the response id and the
     * tool calls exactly as the provider issued them.
     */
    public static Message fromResponse(ToolResponse response) {
        if (response == null) {
            throw new ValidationException("Cannot build a message from a null response");
        }
        return of(Role.assistant, response.getContent(), response.getToolCalls(), response.getResponseId(), null);
    }

    /**
     * Validating factory behind every other constructor.
     * An empty tool call list is normalised to "no tool calls".
     */
    public static Message of(Role role, String content, List<ToolCall> toolCalls, String id, String toolCallId) {
        if (role == null) {
            throw new ValidationException("Message must have a 'role' field");
        }
        if (content == null) {
            throw new ValidationException("Message with role '" + role + "' must have a 'content' field");
        }
        if (role == Role.tool && (toolCallId == null || toolCallId.isBlank())) {
            throw new ValidationException("Tool message must have tool_call_id");
        }
        if (role != Role.tool && toolCallId != null) {
            throw new ValidationException("tool_call_id is only allowed on tool messages, not '" + role + "'");
        }
        List<ToolCall> calls = toolCalls == null || toolCalls.isEmpty() ? null : List.copyOf(toolCalls);
        if (calls != null && role != Role.assistant) {
            throw new ValidationException("tool_calls are only allowed on assistant messages, not '" + role + "'");
        }
        return new Message(role, content, calls, id, toolCallId);
    }

    /**
     * Builds a message from an untyped map, e.g. a decoded request body.
     * {@code tool_calls} may be a list of call maps or a JSON array string.
     */
    public static Message fromMap(Map<String, ?> data) {
        if (data == null) {
            throw new ValidationException("Message data must not be null");
        }
        Role role = Role.parse(stringField(data, "role"));
        Object content = data.get("content");
        if (content != null && !(content instanceof String)) {
            throw new ValidationException("Message 'content' must be a string");
        }
        return of(role, (String) content, toolCallsField(data.get("tool_calls")),
                stringField(data, "id"), stringField(data, "tool_call_id"));
    }

    public static Message fromJson(String json) {
        return fromMap(JsonUtils.parseObject(json));
    }

    public boolean hasToolCalls() {
        return toolCalls != null;
    }

    public Map<String, Object> toMap() {
        return JsonUtils.toMap(this);
    }

    public String toJson() {
        return JsonUtils.toJson(this);
    }

    private static String stringField(Map<String, ?> data, String key) {
        Object value = data.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String s)) {
            throw new ValidationException("Message '" + key + "' must be a string");
        }
        return s;
    }

    @SuppressWarnings("unchecked")
    private static List<ToolCall> toolCallsField(Object raw) {
        if (raw == null) {
            return null;
        }
        List<?> items;
        if (raw instanceof String json) {
            items = JsonUtils.fromJson(json, JsonUtils.LIST_OF_MAPS_TYPE);
        } else if (raw instanceof List<?> list) {
            items = list;
        } else {
            throw new ValidationException("Message 'tool_calls' must be a list");
        }

        List<ToolCall> calls = new ArrayList<>(items.size());
        for (Object item : items) {
            if (item instanceof ToolCall call) {
                calls.add(call);
            } else if (item instanceof Map<?, ?> map) {
                Object arguments = map.get("arguments");
                if (arguments instanceof String argsJson) {
                    arguments = JsonUtils.parseObject(argsJson);
                } else if (arguments != null && !(arguments instanceof Map)) {
                    throw new ValidationException("Tool call 'arguments' must be an object");
                }
                calls.add(ToolCall.of(Objects.toString(map.get("id"), null), Objects.toString(map.get("name"), null),
                        (Map<String, ?>) arguments));
            } else {
                throw new ValidationException("Each entry of 'tool_calls' must be an object");
            }
        }
        return calls;
    }
}
