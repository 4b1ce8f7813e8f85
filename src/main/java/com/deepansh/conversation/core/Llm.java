package com.deepansh.conversation.core;

import com.deepansh.conversation.exception.ValidationException;
import com.deepansh.conversation.llm.LlmProvider;
import com.deepansh.conversation.llm.ModelSpec;
import com.deepansh.conversation.model.MessageCollection;
import com.deepansh.conversation.model.RequestConfig;
import com.deepansh.conversation.model.Response;
import com.deepansh.conversation.tool.ToolDefinition;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * A session bound to one model. Holds default generation options and creates builders that
 * start from them; changing the defaults later does not affect builders already created.
 */
public class Llm {

    private final ModelSpec modelSpec;
    private final LlmProvider provider;
    private RequestConfig defaults = RequestConfig.empty();

    public Llm(ModelSpec modelSpec, LlmProvider provider) {
        if (modelSpec == null || provider == null) {
            throw new ValidationException("Llm requires a model spec and a provider");
        }
        this.modelSpec = modelSpec;
        this.provider = provider;
    }

    public ModelSpec getModelSpec() {
        return modelSpec;
    }

    public LlmProvider getProvider() {
        return provider;
    }

    public RequestConfig getDefaults() {
        return defaults;
    }

    /** Merges snake_case options over the session defaults. */
    public Llm withOptions(Map<String, ?> options) {
        return withOptions(defaults.merge(RequestConfig.fromMap(options)));
    }

    public Llm withOptions(RequestConfig config) {
        this.defaults = (config != null ? config : RequestConfig.empty()).validated();
        return this;
    }

    public Llm setTemperature(double temperature) {
        return withOptions(defaults.toBuilder().temperature(temperature).build());
    }

    public Llm setMaxTokens(int maxTokens) {
        return withOptions(defaults.toBuilder().maxTokens(maxTokens).build());
    }

    public Llm setTopP(double topP) {
        return withOptions(defaults.toBuilder().topP(topP).build());
    }

    public Llm setFrequencyPenalty(double frequencyPenalty) {
        return withOptions(defaults.toBuilder().frequencyPenalty(frequencyPenalty).build());
    }

    public Llm setPresencePenalty(double presencePenalty) {
        return withOptions(defaults.toBuilder().presencePenalty(presencePenalty).build());
    }

    public PlainCompletionBuilder plain() {
        return new PlainCompletionBuilder(provider, modelSpec, defaults);
    }

    /** Shortcut for {@code plain().complete(messages)}. */
    public Response complete(MessageCollection messages) {
        return plain().complete(messages);
    }

    /** Structured completion in {@code json} format, without a schema. */
    public StructuredCompletionBuilder structured() {
        return new StructuredCompletionBuilder(provider, modelSpec, defaults);
    }

    public StructuredCompletionBuilder structured(String schemaJson) {
        return structured().withSchema(schemaJson);
    }

    public StructuredCompletionBuilder structured(Map<String, ?> schema) {
        return structured().withSchema(schema);
    }

    public ToolCompletionBuilder withTools(List<ToolDefinition> tools) {
        return new ToolCompletionBuilder(provider, modelSpec, defaults).setTools(tools);
    }

    public ToolCompletionBuilder withTools(ToolDefinition... tools) {
        return withTools(Arrays.asList(tools));
    }

    @Override
    public String toString() {
        return "Llm(" + modelSpec + ")";
    }
}
