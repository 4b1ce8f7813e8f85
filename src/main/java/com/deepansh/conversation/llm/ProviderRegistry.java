package com.deepansh.conversation.llm;

import com.deepansh.conversation.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Provider adapters indexed by the name used in {@code "provider:model"} strings.
 */
@Slf4j
public class ProviderRegistry {

    private final Map<String, LlmProvider> providers = new ConcurrentHashMap<>();

    public ProviderRegistry register(String name, LlmProvider provider) {
        providers.put(name.toLowerCase(Locale.ROOT), provider);
        log.info("Registered LLM provider: [{}]", name);
        return this;
    }

    /**
     * @throws ValidationException if no provider is registered under {@code name}
     */
    public LlmProvider resolve(String name, ProviderOverrides overrides) {
        LlmProvider provider = providers.get(name.toLowerCase(Locale.ROOT));
        if (provider == null) {
            throw new ValidationException("Unknown LLM provider '" + name + "'. Available providers: " + names());
        }
        if (overrides == null || overrides.isEmpty()) {
            return provider;
        }
        log.debug("Applying session overrides to provider [{}]", name);
        return provider.withOverrides(overrides);
    }

    public boolean hasProvider(String name) {
        return providers.containsKey(name.toLowerCase(Locale.ROOT));
    }

    public Set<String> names() {
        return new TreeSet<>(providers.keySet());
    }
}
