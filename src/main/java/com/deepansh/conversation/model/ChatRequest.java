package com.deepansh.conversation.model;

import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
public class ChatRequest {

    /**
     * Optional "provider:model" selector.
     * Defaults to llm.default-model if not provided.
     */
    private String model;

    @NotEmpty(message = "messages must not be empty")
    private List<Map<String, Object>> messages;

    /**
     * Optional generation options (temperature, max_tokens, top_p, ...) and
     * per-request provider overrides (api_key, base_url, timeout).
     */
    private Map<String, Object> options;
}
