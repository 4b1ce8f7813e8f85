package com.deepansh.conversation.model;

import com.deepansh.conversation.exception.ValidationException;
import com.deepansh.conversation.util.JsonUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered, append-only history of one conversation.
 *
 * Insertion order is conversation order. Messages are immutable and only unmodifiable views
 * leave the collection. Not thread-safe: turns of one conversation must be serialized by the caller.
 */
public class MessageCollection implements Iterable<Message> {

    private final List<Message> messages = new ArrayList<>();

    public MessageCollection() {
    }

    public static MessageCollection of(Message... messages) {
        MessageCollection collection = new MessageCollection();
        for (Message message : messages) {
            collection.append(message);
        }
        return collection;
    }

    /** Builds a collection from untyped message maps, in list order. */
    public static MessageCollection fromMaps(List<? extends Map<String, ?>> data) {
        MessageCollection collection = new MessageCollection();
        if (data != null) {
            data.forEach(m -> collection.append(Message.fromMap(m)));
        }
        return collection;
    }

    public static MessageCollection fromJson(String json) {
        if (json == null || json.isBlank()) {
            throw new ValidationException("Expected a JSON array of messages but got empty input");
        }
        return fromMaps(JsonUtils.fromJson(json, JsonUtils.LIST_OF_MAPS_TYPE));
    }

    public MessageCollection append(Message message) {
        if (message == null) {
            throw new ValidationException("Cannot append a null message");
        }
        messages.add(message);
        return this;
    }

    public MessageCollection appendUser(String content) {
        return append(Message.user(content));
    }

    public MessageCollection appendAssistant(String content) {
        return append(Message.assistant(content));
    }

    public MessageCollection appendSystem(String content) {
        return append(Message.system(content));
    }

    public MessageCollection appendToolResult(String toolCallId, String result) {
        return append(Message.tool(toolCallId, result));
    }

    /**
     * Replays the assistant turn of a tool-calling reply (id and tool calls verbatim).
     * Must be called once per response, before its tool results are appended.
     */
    public MessageCollection fromResponse(ToolResponse response) {
        return append(Message.fromResponse(response));
    }

    /** @return the message at {@code index}, or empty when out of range */
    public Optional<Message> get(int index) {
        if (index < 0 || index >= messages.size()) {
            return Optional.empty();
        }
        return Optional.of(messages.get(index));
    }

    public List<Message> all() {
        return Collections.unmodifiableList(new ArrayList<>(messages));
    }

    public int count() {
        return messages.size();
    }

    public boolean isEmpty() {
        return messages.isEmpty();
    }

    /** Ids of tool calls from the latest replayed turn that still need a result. */
    public List<String> pendingToolCallIds() {
        return ToolCallSequenceValidator.pendingToolCallIds(messages);
    }

    public ToolCallState toolCallState() {
        return pendingToolCallIds().isEmpty() ? ToolCallState.AWAITING_INITIAL : ToolCallState.HAS_TOOL_CALLS;
    }

    public List<Map<String, Object>> toSerializable() {
        return messages.stream().map(Message::toMap).toList();
    }

    public String toJson() {
        return JsonUtils.toJson(messages);
    }

    @Override
    public Iterator<Message> iterator() {
        return all().iterator();
    }

    @Override
    public String toString() {
        return "MessageCollection(count=" + messages.size() + ")";
    }
}
