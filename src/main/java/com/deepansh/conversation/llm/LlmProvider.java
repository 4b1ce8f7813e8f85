package com.deepansh.conversation.llm;

/**
 * The external system that performs the actual inference call.
 * One implementation per vendor API; the conversation layer depends on nothing else.
 */
public interface LlmProvider {

    /**
     * Send the full conversation, generation options and any offered tools to the model.
     * Blocks until the reply arrives.
     *
     * @return content, finish reason, usage and any tool calls the model issued
     * @throws com.deepansh.conversation.exception.LlmConnectionException on network or API failure
     */
    ChatCompletion completeChat(ChatCompletionRequest request);

    /** Whether {@code model} can be constrained to JSON / JSON Schema output. */
    default boolean supportsStructuredOutput(String model) {
        return true;
    }

    /**
     * A provider configured with the given per-session overrides (api key, base url, timeout).
     * Providers without such settings ignore them.
     */
    default LlmProvider withOverrides(ProviderOverrides overrides) {
        return this;
    }
}
