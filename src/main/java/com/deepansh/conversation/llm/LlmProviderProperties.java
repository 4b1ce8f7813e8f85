package com.deepansh.conversation.llm;

import com.deepansh.conversation.exception.ValidationException;
import lombok.Data;

import java.time.Duration;

/**
 * Holds config for a single OpenAI-compatible provider.
 * Populated from application.yml under {@code llm.providers.<name>}.
 */
@Data
public class LlmProviderProperties {
    private String apiKey;
    private String baseUrl;

    /** Applied when a request leaves max_tokens unset; null lets the vendor decide. */
    private Integer maxTokens;

    /** Applied when a request leaves temperature unset; null lets the vendor decide. */
    private Double temperature;

    /** Response timeout; null uses the shared HTTP client default. */
    private Duration timeout;

    /** Set to false for vendors without JSON mode. */
    private boolean structuredOutput = true;

    /**
     * Copy with the overrides applied.
     * A new base url never inherits the configured api key.
     *
     * @throws ValidationException if {@code baseUrl} is overridden without an {@code apiKey}
     */
    public LlmProviderProperties withOverrides(ProviderOverrides overrides) {
        if (overrides.baseUrl() != null && (overrides.apiKey() == null || overrides.apiKey().isBlank())) {
            throw new ValidationException("A base_url override requires its own api_key");
        }
        LlmProviderProperties p = new LlmProviderProperties();
        p.setApiKey(overrides.apiKey() != null ? overrides.apiKey() : apiKey);
        p.setBaseUrl(overrides.baseUrl() != null ? overrides.baseUrl() : baseUrl);
        p.setTimeout(overrides.timeout() != null ? overrides.timeout() : timeout);
        p.setMaxTokens(maxTokens);
        p.setTemperature(temperature);
        p.setStructuredOutput(structuredOutput);
        return p;
    }
}
