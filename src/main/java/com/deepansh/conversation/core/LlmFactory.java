package com.deepansh.conversation.core;

import com.deepansh.conversation.config.LlmProperties;
import com.deepansh.conversation.llm.LlmProvider;
import com.deepansh.conversation.llm.ModelSpec;
import com.deepansh.conversation.llm.ProviderOverrides;
import com.deepansh.conversation.llm.ProviderRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Entry point for callers: turns a {@code "provider:model"} string into an {@link Llm} session.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LlmFactory {

    private final ProviderRegistry providerRegistry;
    private final LlmProperties properties;

    /** Session on the configured default model. */
    public Llm create() {
        return create(properties.getDefaultModel());
    }

    /** Session on the configured default model, with per-session provider settings. */
    public Llm create(ProviderOverrides overrides) {
        return create(properties.getDefaultModel(), overrides);
    }

    public Llm create(String modelSpec) {
        return create(modelSpec, ProviderOverrides.none());
    }

    /**
     * @throws com.deepansh.conversation.exception.ValidationException if the spec is malformed
     *         or names an unknown provider
     */
    public Llm create(String modelSpec, ProviderOverrides overrides) {
        ModelSpec spec = ModelSpec.parse(modelSpec);
        LlmProvider provider = providerRegistry.resolve(spec.provider(), overrides);
        log.info("LLM session created [model={}, overrides={}]", spec,
                overrides != null && !overrides.isEmpty());
        return new Llm(spec, provider);
    }
}
