package com.deepansh.conversation.llm;

import com.deepansh.conversation.exception.ValidationException;

import java.util.Locale;

/**
 * A {@code "provider:model"} selector, e.g. {@code openai:gpt-4o} or {@code groq:llama-3.3-70b-versatile}.
 * Only the first colon separates the two parts; model ids may contain further colons.
 */
public record ModelSpec(String provider, String model) {

    public static ModelSpec parse(String spec) {
        if (spec == null || spec.isBlank()) {
            throw new ValidationException("Model must be given as 'provider:model'");
        }
        int colon = spec.indexOf(':');
        if (colon <= 0 || colon == spec.length() - 1) {
            throw new ValidationException("Model '" + spec + "' must be given as 'provider:model'");
        }
        String provider = spec.substring(0, colon).trim().toLowerCase(Locale.ROOT);
        String model = spec.substring(colon + 1).trim();
        if (provider.isEmpty() || model.isEmpty()) {
            throw new ValidationException("Model '" + spec + "' must be given as 'provider:model'");
        }
        return new ModelSpec(provider, model);
    }

    @Override
    public String toString() {
        return provider + ":" + model;
    }
}
