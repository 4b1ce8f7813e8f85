package com.deepansh.conversation.llm;

import com.deepansh.conversation.exception.ValidationException;

import java.util.Locale;

/**
 * How a structured completion constrains the model's output.
 */
public enum ResponseFormat {

    /** Any syntactically valid JSON. */
    JSON("json"),

    /** JSON conforming to a caller-supplied schema. */
    JSON_SCHEMA("json_schema");

    private final String wireName;

    ResponseFormat(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static ResponseFormat parse(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (ResponseFormat format : values()) {
                if (format.wireName.equals(normalized)) {
                    return format;
                }
            }
        }
        throw new ValidationException("Unsupported structured output format '" + value
                + "' (expected 'json' or 'json_schema')");
    }
}
