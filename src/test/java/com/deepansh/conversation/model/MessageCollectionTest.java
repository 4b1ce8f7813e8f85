package com.deepansh.conversation.model;

import com.deepansh.conversation.exception.ToolCallException;
import com.deepansh.conversation.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MessageCollectionTest {

    private static ToolResponse weatherCall() {
        return new ToolResponse("", List.of(
                ToolCall.of("call_1", "get_weather", Map.of("city", "Paris")),
                ToolCall.of("call_2", "get_weather", Map.of("city", "Rome"))),
                Usage.of(20, 10), "openai:gpt-4o", "tool_calls", "resp_1");
    }

    @Test
    void append_keepsInsertionOrder() {
        MessageCollection messages = new MessageCollection()
                .appendSystem("Be brief")
                .appendUser("Hi")
                .appendAssistant("Hello");

        assertThat(messages.count()).isEqualTo(3);
        assertThat(messages.all()).extracting(Message::getRole)
                .containsExactly(Message.Role.system, Message.Role.user, Message.Role.assistant);
    }

    @Test
    void append_null_throws() {
        assertThatThrownBy(() -> new MessageCollection().append(null))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void get_outOfRange_returnsEmpty() {
        MessageCollection messages = MessageCollection.of(Message.user("Hi"));

        assertThat(messages.get(0)).contains(Message.user("Hi"));
        assertThat(messages.get(1)).isEmpty();
        assertThat(messages.get(-1)).isEmpty();
    }

    @Test
    void all_isUnmodifiableSnapshot() {
        MessageCollection messages = MessageCollection.of(Message.user("Hi"));
        List<Message> snapshot = messages.all();

        messages.appendAssistant("Hello");

        assertThat(snapshot).hasSize(1);
        assertThatThrownBy(() -> snapshot.add(Message.user("x")))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void fromResponse_appendsAssistantTurnAndTracksPendingCalls() {
        MessageCollection messages = MessageCollection.of(Message.user("Weather in Paris and Rome?"));

        messages.fromResponse(weatherCall());

        assertThat(messages.count()).isEqualTo(2);
        assertThat(messages.get(1).orElseThrow().getId()).isEqualTo("resp_1");
        assertThat(messages.pendingToolCallIds()).containsExactly("call_1", "call_2");
        assertThat(messages.toolCallState()).isEqualTo(ToolCallState.HAS_TOOL_CALLS);

        messages.appendToolResult("call_1", "18C").appendToolResult("call_2", "22C");

        assertThat(messages.pendingToolCallIds()).isEmpty();
        assertThat(messages.toolCallState()).isEqualTo(ToolCallState.AWAITING_INITIAL);
    }

    @Test
    void pendingToolCallIds_toolResultWithoutReplay_throws() {
        MessageCollection messages = MessageCollection.of(Message.user("Hi"))
                .appendToolResult("call_1", "18C");

        assertThatThrownBy(messages::pendingToolCallIds)
                .isInstanceOf(ToolCallException.class)
                .hasMessageContaining("fromResponse");
    }

    @Test
    void toSerializable_matchesMessageMaps() {
        MessageCollection messages = MessageCollection.of(Message.user("Hi"), Message.assistant("Hello"));

        assertThat(messages.toSerializable()).containsExactly(
                Map.of("role", "user", "content", "Hi"),
                Map.of("role", "assistant", "content", "Hello"));
    }

    @Test
    void fromJson_rebuildsConversation() {
        MessageCollection messages = MessageCollection.of(Message.user("Weather?"))
                .fromResponse(weatherCall())
                .appendToolResult("call_1", "18C")
                .appendToolResult("call_2", "22C");

        MessageCollection copy = MessageCollection.fromJson(messages.toJson());

        assertThat(copy.all()).isEqualTo(messages.all());
    }

    @Test
    void fromJson_notAnArray_throws() {
        assertThatThrownBy(() -> MessageCollection.fromJson("{\"role\":\"user\"}"))
                .isInstanceOf(ValidationException.class);
    }
}
