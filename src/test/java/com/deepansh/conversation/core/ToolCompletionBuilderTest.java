package com.deepansh.conversation.core;

import com.deepansh.conversation.exception.ToolCallException;
import com.deepansh.conversation.exception.ValidationException;
import com.deepansh.conversation.llm.ChatCompletion;
import com.deepansh.conversation.llm.ChatCompletionRequest;
import com.deepansh.conversation.llm.LlmProvider;
import com.deepansh.conversation.llm.ModelSpec;
import com.deepansh.conversation.model.Message;
import com.deepansh.conversation.model.MessageCollection;
import com.deepansh.conversation.model.RequestConfig;
import com.deepansh.conversation.model.ToolCall;
import com.deepansh.conversation.model.ToolCallState;
import com.deepansh.conversation.model.ToolResponse;
import com.deepansh.conversation.model.Usage;
import com.deepansh.conversation.tool.ToolDefinition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ToolCompletionBuilderTest {

    private static final ToolDefinition GET_WEATHER = ToolDefinition.of("get_weather", "Current weather for a location",
            "{\"type\":\"object\",\"properties\":{\"location\":{\"type\":\"string\"}},\"required\":[\"location\"]}");

    @Mock
    private LlmProvider provider;

    private ToolCompletionBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new ToolCompletionBuilder(provider, ModelSpec.parse("openai:gpt-4o"), RequestConfig.empty())
                .addTool(GET_WEATHER);
    }

    private static ChatCompletion weatherCall() {
        return ChatCompletion.builder()
                .content("")
                .finishReason("tool_calls")
                .usage(Usage.of(50, 12))
                .toolCalls(List.of(ToolCall.of("call_1", "get_weather", Map.of("location", "Paris"))))
                .responseId("chatcmpl-1")
                .build();
    }

    @Test
    void complete_weatherRoundTrip_endsTerminal() {
        when(provider.completeChat(any()))
                .thenReturn(weatherCall())
                .thenReturn(ChatCompletion.builder()
                        .content("It is 18C and sunny in Paris.")
                        .usage(Usage.of(80, 10))
                        .build());
        MessageCollection messages = MessageCollection.of(
                Message.system("You are a weather assistant."),
                Message.user("What's the weather in Paris?"));

        ToolResponse first = builder.complete(messages);

        assertThat(first.getState()).isEqualTo(ToolCallState.HAS_TOOL_CALLS);
        assertThat(first.getToolCalls()).singleElement().satisfies(call -> {
            assertThat(call.getId()).isEqualTo("call_1");
            assertThat(call.getArguments()).isEqualTo(Map.of("location", "Paris"));
        });

        int before = messages.count();
        messages.fromResponse(first)
                .appendToolResult("call_1", "{\"temp\":18}");
        assertThat(messages.count()).isEqualTo(before + 2);

        ToolResponse second = builder.complete(messages);

        assertThat(second.getState()).isEqualTo(ToolCallState.TERMINAL);
        assertThat(second.getContent()).contains("18C");

        ArgumentCaptor<ChatCompletionRequest> captor = ArgumentCaptor.forClass(ChatCompletionRequest.class);
        verify(provider, times(2)).completeChat(captor.capture());
        List<Message> sent = captor.getAllValues().get(1).getMessages();
        assertThat(sent).hasSize(4);
        assertThat(sent.get(0).getRole()).isEqualTo(Message.Role.system);
        assertThat(sent.get(2).getId()).isEqualTo("chatcmpl-1");
        assertThat(sent.get(2).getToolCalls()).isEqualTo(first.getToolCalls());
        assertThat(sent.get(3).getToolCallId()).isEqualTo("call_1");
        assertThat(sent.get(3).getContent()).isEqualTo("{\"temp\":18}");
    }

    @Test
    void complete_toolResultWithoutReplay_throwsBeforeDispatch() {
        when(provider.completeChat(any())).thenReturn(weatherCall());
        MessageCollection messages = MessageCollection.of(Message.user("Weather?"));
        builder.complete(messages);

        messages.appendToolResult("call_1", "18C");

        assertThatThrownBy(() -> builder.complete(messages))
                .isInstanceOf(ToolCallException.class)
                .hasMessageContaining("fromResponse");
        verify(provider, times(1)).completeChat(any());
    }

    @Test
    void complete_missingToolResult_throwsBeforeDispatch() {
        MessageCollection messages = MessageCollection.of(Message.user("Weather?"));
        messages.fromResponse(new ToolResponse("", weatherCall().getToolCalls(), null, "openai:gpt-4o",
                "tool_calls", "chatcmpl-1"));

        assertThatThrownBy(() -> builder.complete(messages))
                .isInstanceOf(ToolCallException.class)
                .hasMessageContaining("call_1");
        verify(provider, never()).completeChat(any());
    }

    @Test
    void complete_unknownToolName_throwsWithUsage() {
        when(provider.completeChat(any())).thenReturn(ChatCompletion.builder()
                .usage(Usage.of(9, 1))
                .toolCalls(List.of(ToolCall.of("call_1", "delete_everything", Map.of())))
                .build());

        assertThatThrownBy(() -> builder.complete(MessageCollection.of(Message.user("Hi"))))
                .isInstanceOf(ToolCallException.class)
                .hasMessageContaining("delete_everything")
                .satisfies(e -> assertThat(((ToolCallException) e).getUsage()).isEqualTo(Usage.of(9, 1)));
    }

    @Test
    void complete_duplicateCallIds_throws() {
        when(provider.completeChat(any())).thenReturn(ChatCompletion.builder()
                .toolCalls(List.of(
                        ToolCall.of("call_1", "get_weather", Map.of("location", "Paris")),
                        ToolCall.of("call_1", "get_weather", Map.of("location", "Rome"))))
                .build());

        assertThatThrownBy(() -> builder.complete(MessageCollection.of(Message.user("Hi"))))
                .isInstanceOf(ToolCallException.class)
                .hasMessageContaining("Duplicate");
    }

    @Test
    void complete_sendsOfferedTools() {
        when(provider.completeChat(any())).thenReturn(ChatCompletion.builder().content("Hi").build());

        builder.complete(MessageCollection.of(Message.user("Hi")));

        ArgumentCaptor<ChatCompletionRequest> captor = ArgumentCaptor.forClass(ChatCompletionRequest.class);
        verify(provider).completeChat(captor.capture());
        assertThat(captor.getValue().getTools()).containsExactly(GET_WEATHER);
    }

    @Test
    void complete_noTools_sendsNone() {
        when(provider.completeChat(any())).thenReturn(ChatCompletion.builder().content("Hi").build());

        ToolResponse response = builder.setTools(List.of()).complete(MessageCollection.of(Message.user("Hi")));

        ArgumentCaptor<ChatCompletionRequest> captor = ArgumentCaptor.forClass(ChatCompletionRequest.class);
        verify(provider).completeChat(captor.capture());
        assertThat(captor.getValue().hasTools()).isFalse();
        assertThat(response.getState()).isEqualTo(ToolCallState.TERMINAL);
    }

    @Test
    void addTool_duplicateName_throws() {
        assertThatThrownBy(() -> builder.addTool(GET_WEATHER))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("get_weather");
    }

    @Test
    void setTools_duplicateName_keepsPreviousTools() {
        assertThatThrownBy(() -> builder.setTools(List.of(GET_WEATHER, GET_WEATHER)))
                .isInstanceOf(ValidationException.class);
        assertThat(builder.getTools()).containsExactly(GET_WEATHER);
    }

    @Test
    void setToolsFromMaps_buildsDefinitions() {
        builder.setToolsFromMaps(List.of(Map.of(
                "name", "search",
                "description", "Web search",
                "parameters", Map.of("type", "object"))));

        assertThat(builder.getTools()).extracting(ToolDefinition::getName).containsExactly("search");
    }

    @Test
    void setAutoExecute_isStoredOnly() {
        when(provider.completeChat(any())).thenReturn(weatherCall());

        ToolResponse response = builder.setAutoExecute(true).complete(MessageCollection.of(Message.user("Weather?")));

        assertThat(builder.isAutoExecute()).isTrue();
        assertThat(response.getToolCalls()).hasSize(1);
        verify(provider, times(1)).completeChat(any());
    }
}
