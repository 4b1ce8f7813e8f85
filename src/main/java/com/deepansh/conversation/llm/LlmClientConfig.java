package com.deepansh.conversation.llm;

import com.deepansh.conversation.config.LlmProperties;
import com.deepansh.conversation.config.RequestFactoryCache;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

import java.util.Locale;
import java.util.Map;

/**
 * Registers one {@link GenericLlmProvider} per entry under {@code llm.providers}.
 * Any of them can then be addressed with a {@code "provider:model"} string.
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class LlmClientConfig {

    private static final Map<String, String> KEY_SIGNUP_URLS = Map.of(
            "openai", "https://platform.openai.com/api-keys",
            "groq", "https://console.groq.com/keys",
            "gemini", "https://aistudio.google.com/app/apikey");

    private final LlmProperties properties;

    @PostConstruct
    public void logDefaultModel() {
        log.info("================================================================");
        log.info("  Default LLM model   : {}", properties.getDefaultModel());
        log.info("  Configured providers: {}", properties.getProviders().keySet());
        log.info("================================================================");
    }

    @Bean
    public ProviderRegistry providerRegistry(ObjectMapper objectMapper,
                                             @Qualifier("llmRestClientBuilder") RestClient.Builder builder,
                                             RequestFactoryCache llmRequestFactories) {
        ProviderRegistry registry = new ProviderRegistry();
        properties.getProviders().forEach((name, props) -> {
            logKey(name, props.getApiKey());
            RestClient.Builder providerBuilder = builder.clone();
            if (props.getTimeout() != null) {
                providerBuilder.requestFactory(llmRequestFactories.forTimeout(props.getTimeout()));
            }
            registry.register(name, new GenericLlmProvider(props, objectMapper, name, providerBuilder,
                    llmRequestFactories));
        });
        return registry;
    }

    private void logKey(String name, String key) {
        if (key == null || key.isBlank()) {
            String envVar = name.toUpperCase(Locale.ROOT) + "_API_KEY";
            log.warn("  {} API key not set! Set env var: {}={your-key}", name, envVar);
            if (KEY_SIGNUP_URLS.containsKey(name)) {
                log.warn("  Get a key at: {}", KEY_SIGNUP_URLS.get(name));
            }
        } else {
            log.info("  {} key: {}...{}", name, key.substring(0, Math.min(8, key.length())),
                    key.length() > 8 ? key.substring(key.length() - 4) : "");
        }
    }
}
