package com.deepansh.conversation.llm;

import com.deepansh.conversation.exception.ValidationException;
import lombok.Builder;

import java.time.Duration;
import java.util.Map;

/**
 * Per-session settings handed to the provider adapter untouched.
 * A null component keeps the configured value.
 */
@Builder
public record ProviderOverrides(
        String apiKey,
        String baseUrl,
        Duration timeout
) {

    private static final ProviderOverrides NONE = new ProviderOverrides(null, null, null);

    public static ProviderOverrides none() {
        return NONE;
    }

    /** Reads {@code api_key}, {@code base_url} and {@code timeout} (seconds). */
    public static ProviderOverrides fromMap(Map<String, ?> options) {
        if (options == null || options.isEmpty()) {
            return NONE;
        }
        Object timeout = options.get("timeout");
        if (timeout != null && !(timeout instanceof Number)) {
            throw new ValidationException("timeout must be a number of seconds but was '" + timeout + "'");
        }
        if (timeout != null && ((Number) timeout).doubleValue() <= 0) {
            throw new ValidationException("timeout must be greater than 0");
        }
        return new ProviderOverrides(
                options.get("api_key") != null ? options.get("api_key").toString() : null,
                options.get("base_url") != null ? options.get("base_url").toString() : null,
                timeout != null ? Duration.ofMillis(Math.round(((Number) timeout).doubleValue() * 1000)) : null);
    }

    public boolean isEmpty() {
        return apiKey == null && baseUrl == null && timeout == null;
    }
}
