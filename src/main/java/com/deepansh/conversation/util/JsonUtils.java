package com.deepansh.conversation.util;

import com.deepansh.conversation.exception.LlmException;
import com.deepansh.conversation.exception.ValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.util.List;
import java.util.Map;

/**
 * Shared Jackson mapper for the wire representation of conversation entities.
 * Domain objects are not Spring beans, so they serialize through this instead of the context's mapper.
 */
public final class JsonUtils {

    public static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    public static final TypeReference<List<Map<String, Object>>> LIST_OF_MAPS_TYPE = new TypeReference<>() {};

    private static final ObjectMapper OBJECT_MAPPER = JsonMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private JsonUtils() {
    }

    public static ObjectMapper objectMapper() {
        return OBJECT_MAPPER;
    }

    public static String toJson(Object value) {
        try {
            return OBJECT_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new LlmException("Failed to serialize to JSON: " + e.getOriginalMessage(), e);
        }
    }

    public static Map<String, Object> toMap(Object value) {
        return OBJECT_MAPPER.convertValue(value, MAP_TYPE);
    }

    /** Deep copy of a JSON-like map; nested maps and lists are fresh instances. */
    public static Map<String, Object> copyOf(Map<String, ?> value) {
        return OBJECT_MAPPER.convertValue(value, MAP_TYPE);
    }

    public static <T> T fromJson(String json, Class<T> type) {
        try {
            return OBJECT_MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw invalid(type.getSimpleName(), e);
        }
    }

    public static <T> T fromJson(String json, TypeReference<T> type) {
        try {
            return OBJECT_MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw invalid("value", e);
        }
    }

    /** Parses a JSON object; anything else (array, scalar, broken text) is a validation failure. */
    public static Map<String, Object> parseObject(String json) {
        if (json == null || json.isBlank()) {
            throw new ValidationException("Expected a JSON object but got empty input");
        }
        return fromJson(json, MAP_TYPE);
    }

    private static ValidationException invalid(String what, JsonProcessingException e) {
        // Creator-level validation failures surface wrapped by Jackson; keep their message.
        if (e.getCause() instanceof ValidationException cause) {
            return cause;
        }
        return new ValidationException("Invalid JSON for " + what + ": " + e.getOriginalMessage(), e);
    }
}
