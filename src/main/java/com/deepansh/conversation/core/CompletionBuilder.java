package com.deepansh.conversation.core;

import com.deepansh.conversation.exception.LlmConnectionException;
import com.deepansh.conversation.exception.LlmException;
import com.deepansh.conversation.exception.ValidationException;
import com.deepansh.conversation.llm.ChatCompletion;
import com.deepansh.conversation.llm.ChatCompletionRequest;
import com.deepansh.conversation.llm.LlmProvider;
import com.deepansh.conversation.llm.ModelSpec;
import com.deepansh.conversation.model.Message;
import com.deepansh.conversation.model.MessageCollection;
import com.deepansh.conversation.model.RequestConfig;
import com.deepansh.conversation.model.ToolCallSequenceValidator;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;

/**
 * Shared state and dispatch logic of the completion builders.
 *
 * Setters replace the immutable {@link RequestConfig} and return the same builder, so a
 * builder can be configured once and reused for every turn of a conversation.
 * A builder is not thread-safe.
 *
 * @param <B> concrete builder type, returned by the fluent setters
 */
@Slf4j
public abstract class CompletionBuilder<B extends CompletionBuilder<B>> {

    protected final LlmProvider provider;
    protected final ModelSpec modelSpec;
    private RequestConfig config;

    protected CompletionBuilder(LlmProvider provider, ModelSpec modelSpec, RequestConfig defaults) {
        if (provider == null) {
            throw new ValidationException("A provider is required");
        }
        if (modelSpec == null) {
            throw new ValidationException("A model spec is required");
        }
        this.provider = provider;
        this.modelSpec = modelSpec;
        this.config = defaults != null ? defaults : RequestConfig.empty();
    }

    public B setTemperature(double temperature) {
        return withOptions(config.toBuilder().temperature(temperature).build());
    }

    public B setMaxTokens(int maxTokens) {
        return withOptions(config.toBuilder().maxTokens(maxTokens).build());
    }

    public B setTopP(double topP) {
        return withOptions(config.toBuilder().topP(topP).build());
    }

    public B setFrequencyPenalty(double frequencyPenalty) {
        return withOptions(config.toBuilder().frequencyPenalty(frequencyPenalty).build());
    }

    public B setPresencePenalty(double presencePenalty) {
        return withOptions(config.toBuilder().presencePenalty(presencePenalty).build());
    }

    /** Merges snake_case options (e.g. {@code max_tokens}) over the current config. */
    public B withOptions(Map<String, ?> options) {
        return withOptions(config.merge(RequestConfig.fromMap(options)));
    }

    /**
     * Replaces the config.
     *
     * @throws ValidationException if a value is out of range; the previous config is kept
     */
    public B withOptions(RequestConfig newConfig) {
        this.config = (newConfig != null ? newConfig : RequestConfig.empty()).validated();
        return self();
    }

    public RequestConfig getConfig() {
        return config;
    }

    public ModelSpec getModelSpec() {
        return modelSpec;
    }

    @SuppressWarnings("unchecked")
    protected B self() {
        return (B) this;
    }

    /**
     * Checks the conversation, then performs the single blocking provider call.
     * The request's model and config are filled in here.
     */
    protected ChatCompletion dispatch(MessageCollection messages, ChatCompletionRequest.ChatCompletionRequestBuilder request) {
        if (messages == null) {
            throw new ValidationException("messages must not be null");
        }
        if (messages.isEmpty()) {
            throw new ValidationException("Cannot complete an empty conversation");
        }
        List<Message> snapshot = messages.all();
        ToolCallSequenceValidator.validate(snapshot);

        ChatCompletionRequest built = request
                .model(modelSpec.model())
                .messages(snapshot)
                .config(config)
                .build();

        log.debug("Dispatching {} messages to {} [tools={}, format={}]",
                snapshot.size(), modelSpec, built.getTools().size(), built.getResponseFormat());

        ChatCompletion completion;
        try {
            completion = provider.completeChat(built);
        } catch (LlmException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Provider call to {} failed: {}", modelSpec, e.getMessage());
            throw new LlmConnectionException(e.getMessage(), e);
        }

        if (completion == null) {
            throw new LlmConnectionException("Provider for " + modelSpec + " returned no completion");
        }
        log.debug("Completion from {} [finishReason={}, toolCalls={}, totalTokens={}]",
                modelSpec, completion.getFinishReason(), completion.getToolCalls().size(),
                completion.getUsage().getTotalTokens());
        return completion;
    }
}
