package com.deepansh.conversation.core;

import com.deepansh.conversation.exception.LlmConnectionException;
import com.deepansh.conversation.exception.ToolCallException;
import com.deepansh.conversation.exception.ValidationException;
import com.deepansh.conversation.llm.ChatCompletion;
import com.deepansh.conversation.llm.ChatCompletionRequest;
import com.deepansh.conversation.llm.LlmProvider;
import com.deepansh.conversation.llm.ModelSpec;
import com.deepansh.conversation.model.Message;
import com.deepansh.conversation.model.MessageCollection;
import com.deepansh.conversation.model.RequestConfig;
import com.deepansh.conversation.model.Response;
import com.deepansh.conversation.model.ToolCall;
import com.deepansh.conversation.model.Usage;
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
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PlainCompletionBuilderTest {

    @Mock
    private LlmProvider provider;

    private PlainCompletionBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new PlainCompletionBuilder(provider, ModelSpec.parse("openai:gpt-4o-mini"), RequestConfig.empty());
    }

    @Test
    void complete_mapsProviderReply() {
        when(provider.completeChat(any())).thenReturn(ChatCompletion.builder()
                .content("Hello there")
                .finishReason("stop")
                .usage(Usage.of(12, 3))
                .build());

        Response response = builder.complete(MessageCollection.of(Message.user("Hi")));

        assertThat(response.getContent()).isEqualTo("Hello there");
        assertThat(response.getModel()).isEqualTo("openai:gpt-4o-mini");
        assertThat(response.getUsage().getTotalTokens()).isEqualTo(15);
    }

    @Test
    void complete_nullContentAndFinishReason_areDefaulted() {
        when(provider.completeChat(any())).thenReturn(ChatCompletion.builder().build());

        Response response = builder.complete(MessageCollection.of(Message.user("Hi")));

        assertThat(response.getContent()).isEmpty();
        assertThat(response.getFinishReason()).isEqualTo("stop");
        assertThat(response.getUsage()).isEqualTo(Usage.empty());
    }

    @Test
    void complete_sendsModelMessagesAndConfig() {
        when(provider.completeChat(any())).thenReturn(ChatCompletion.builder().content("ok").build());
        MessageCollection messages = MessageCollection.of(Message.system("Be brief"), Message.user("Hi"));

        builder.setTemperature(0.2).setMaxTokens(50).complete(messages);

        ArgumentCaptor<ChatCompletionRequest> captor = ArgumentCaptor.forClass(ChatCompletionRequest.class);
        verify(provider).completeChat(captor.capture());
        ChatCompletionRequest request = captor.getValue();
        assertThat(request.getModel()).isEqualTo("gpt-4o-mini");
        assertThat(request.getMessages()).isEqualTo(messages.all());
        assertThat(request.getConfig().getTemperature()).isEqualTo(0.2);
        assertThat(request.getConfig().getMaxTokens()).isEqualTo(50);
        assertThat(request.hasTools()).isFalse();
        assertThat(request.getResponseFormat()).isNull();
    }

    @Test
    void setters_returnSameBuilder() {
        assertThat(builder.setTopP(0.5)).isSameAs(builder);
        assertThat(builder.withOptions(Map.of("presence_penalty", 1.0))).isSameAs(builder);
        assertThat(builder.getConfig().getTopP()).isEqualTo(0.5);
        assertThat(builder.getConfig().getPresencePenalty()).isEqualTo(1.0);
    }

    @Test
    void setTemperature_outOfRange_throwsAndKeepsConfig() {
        builder.setTemperature(1.0);

        assertThatThrownBy(() -> builder.setTemperature(3.0))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("temperature");
        assertThat(builder.getConfig().getTemperature()).isEqualTo(1.0);
    }

    @Test
    void complete_emptyConversation_throwsWithoutCallingProvider() {
        assertThatThrownBy(() -> builder.complete(new MessageCollection()))
                .isInstanceOf(ValidationException.class);
        verify(provider, never()).completeChat(any());
    }

    @Test
    void complete_unexpectedProviderFailure_isWrapped() {
        when(provider.completeChat(any())).thenThrow(new IllegalStateException("socket closed"));

        assertThatThrownBy(() -> builder.complete(MessageCollection.of(Message.user("Hi"))))
                .isInstanceOf(LlmConnectionException.class)
                .hasMessageContaining("socket closed")
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void complete_connectionFailure_propagatesUnchanged() {
        LlmConnectionException failure = new LlmConnectionException("503 from vendor", 503, null);
        when(provider.completeChat(any())).thenThrow(failure);

        assertThatThrownBy(() -> builder.complete(MessageCollection.of(Message.user("Hi"))))
                .isSameAs(failure);
    }

    @Test
    void complete_unrequestedToolCalls_throws() {
        when(provider.completeChat(any())).thenReturn(ChatCompletion.builder()
                .toolCalls(List.of(ToolCall.of("call_1", "get_weather", Map.of())))
                .usage(Usage.of(4, 4))
                .build());

        assertThatThrownBy(() -> builder.complete(MessageCollection.of(Message.user("Hi"))))
                .isInstanceOf(ToolCallException.class)
                .satisfies(e -> assertThat(((ToolCallException) e).getUsage()).isEqualTo(Usage.of(4, 4)));
    }
}
