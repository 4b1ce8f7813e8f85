package com.deepansh.conversation.config;

import com.deepansh.conversation.llm.LlmProviderProperties;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Strongly-typed configuration for provider selection and HTTP transport.
 * Bound from application.yml under the "llm" prefix.
 */
@ConfigurationProperties(prefix = "llm")
@Data
public class LlmProperties {

    /** Used when a caller does not name a model; "provider:model". */
    private String defaultModel = "openai:gpt-4o-mini";

    private Map<String, LlmProviderProperties> providers = new LinkedHashMap<>();

    private Http http = new Http();

    @Data
    public static class Http {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration responseTimeout = Duration.ofSeconds(60);

        /** Upper bound for per-provider and per-session timeouts. */
        private Duration maxResponseTimeout = Duration.ofMinutes(5);
        private int maxConnections = 50;
    }
}
