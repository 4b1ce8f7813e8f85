package com.deepansh.conversation.model;

import com.deepansh.conversation.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MessageTest {

    @Test
    void user_setsRoleAndContent() {
        Message message = Message.user("Hello");

        assertThat(message.getRole()).isEqualTo(Message.Role.user);
        assertThat(message.getContent()).isEqualTo("Hello");
        assertThat(message.getToolCallId()).isNull();
        assertThat(message.hasToolCalls()).isFalse();
    }

    @Test
    void tool_withoutCallId_throws() {
        assertThatThrownBy(() -> Message.tool(null, "result"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("tool_call_id");
        assertThatThrownBy(() -> Message.tool(" ", "result"))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void of_nullContent_throws() {
        assertThatThrownBy(() -> Message.user(null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("content");
    }

    @Test
    void of_toolCallIdOnUserMessage_throws() {
        assertThatThrownBy(() -> Message.of(Message.Role.user, "hi", null, null, "call_1"))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void of_toolCallsOnNonAssistant_throws() {
        List<ToolCall> calls = List.of(ToolCall.of("call_1", "get_weather", Map.of()));

        assertThatThrownBy(() -> Message.of(Message.Role.user, "hi", calls, null, null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("assistant");
    }

    @Test
    void of_emptyToolCalls_normalisedToNone() {
        Message message = Message.of(Message.Role.assistant, "done", List.of(), null, null);

        assertThat(message.hasToolCalls()).isFalse();
        assertThat(message.toMap()).doesNotContainKey("tool_calls");
    }

    @Test
    void fromResponse_keepsIdAndToolCallsVerbatim() {
        ToolCall call = ToolCall.of("call_1", "get_weather", Map.of("city", "Paris"));
        ToolResponse response = new ToolResponse("", List.of(call), Usage.of(10, 5), "openai:gpt-4o",
                "tool_calls", "resp_42");

        Message message = Message.fromResponse(response);

        assertThat(message.getRole()).isEqualTo(Message.Role.assistant);
        assertThat(message.getId()).isEqualTo("resp_42");
        assertThat(message.getToolCalls()).containsExactly(call);
        assertThatThrownBy(() -> message.getToolCalls().add(call))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void toMap_omitsAbsentOptionals() {
        assertThat(Message.user("Hi").toMap()).containsOnlyKeys("role", "content");
        assertThat(Message.tool("call_1", "18C").toMap())
                .containsEntry("role", "tool")
                .containsEntry("tool_call_id", "call_1");
    }

    @Test
    void fromMap_acceptsToolCallsAsJsonString() {
        Map<String, Object> data = Map.of(
                "role", "assistant",
                "content", "",
                "tool_calls", "[{\"id\":\"call_1\",\"name\":\"get_weather\",\"arguments\":\"{\\\"city\\\":\\\"Paris\\\"}\"}]");

        Message message = Message.fromMap(data);

        assertThat(message.getToolCalls()).hasSize(1);
        assertThat(message.getToolCalls().get(0).getArguments()).containsEntry("city", "Paris");
    }

    @Test
    void fromMap_invalidRole_throws() {
        assertThatThrownBy(() -> Message.fromMap(Map.of("role", "robot", "content", "x")))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("robot");
    }

    @Test
    void fromMap_missingRole_throws() {
        assertThatThrownBy(() -> Message.fromMap(Map.of("content", "x")))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("role");
    }

    @Test
    void fromJson_roundTripsAssistantWithToolCalls() {
        Message original = Message.of(Message.Role.assistant, "",
                List.of(ToolCall.of("call_1", "get_weather", Map.of("city", "Paris"))), "resp_1", null);

        Message copy = Message.fromJson(original.toJson());

        assertThat(copy).isEqualTo(original);
        assertThat(copy.toMap()).isEqualTo(original.toMap());
    }
}
