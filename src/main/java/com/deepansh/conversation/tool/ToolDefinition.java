package com.deepansh.conversation.tool;

import com.deepansh.conversation.exception.ValidationException;
import com.deepansh.conversation.util.JsonUtils;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Immutable function contract offered to the model.
 * Decouples the caller-facing tool description from any vendor serialization format.
 */
@Getter
@EqualsAndHashCode
@ToString
@JsonPropertyOrder({"name", "description", "parameters"})
public final class ToolDefinition {

    // Most restrictive common denominator of the vendor APIs
    private static final Pattern NAME_PATTERN = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    private final String name;
    private final String description;

    /** JSON Schema of the arguments; always an object schema. */
    private final Map<String, Object> parameters;

    private ToolDefinition(String name, String description, Map<String, Object> parameters) {
        this.name = name;
        this.description = description;
        this.parameters = parameters;
    }

    /**
     * @throws ValidationException if the name is not identifier-safe, the description is blank,
     *                             or the parameters are not a JSON Schema of {@code "type": "object"}
     */
    public static ToolDefinition of(String name, String description, Map<String, ?> parameters) {
        if (name == null || !NAME_PATTERN.matcher(name).matches()) {
            throw new ValidationException("Tool name '" + name
                    + "' must be 1-64 characters of letters, digits, '_' or '-'");
        }
        if (description == null || description.isBlank()) {
            throw new ValidationException("Tool '" + name + "' must have a non-blank description");
        }
        if (parameters == null) {
            throw new ValidationException("Tool '" + name + "' must have a 'parameters' schema");
        }
        if (!"object".equals(parameters.get("type"))) {
            throw new ValidationException("Tool '" + name
                    + "' parameters must be a JSON Schema with \"type\": \"object\" but type was "
                    + parameters.get("type"));
        }
        Object properties = parameters.get("properties");
        if (properties != null && !(properties instanceof Map)) {
            throw new ValidationException("Tool '" + name + "' parameters.properties must be an object");
        }
        return new ToolDefinition(name, description, Collections.unmodifiableMap(JsonUtils.copyOf(parameters)));
    }

    /** Same as {@link #of(String, String, Map)} with the schema given as JSON text. */
    public static ToolDefinition of(String name, String description, String parametersJson) {
        Map<String, Object> parameters;
        try {
            parameters = JsonUtils.parseObject(parametersJson);
        } catch (ValidationException e) {
            throw new ValidationException("Tool '" + name + "' has an invalid JSON schema: " + e.getMessage(), e);
        }
        return of(name, description, parameters);
    }

    /**
     * Builds a definition from an untyped map (external deserialization).
     * {@code parameters} may be a nested map or a JSON string.
     */
    @SuppressWarnings("unchecked")
    public static ToolDefinition fromMap(Map<String, ?> data) {
        if (data == null) {
            throw new ValidationException("Tool data must not be null");
        }
        Object name = data.get("name");
        if (!(name instanceof String)) {
            throw new ValidationException("Tool must have 'name' field");
        }
        Object description = data.get("description");
        if (!(description instanceof String)) {
            throw new ValidationException("Tool must have 'description' field");
        }
        Object parameters = data.get("parameters");
        if (parameters instanceof String json) {
            return of((String) name, (String) description, json);
        }
        if (parameters instanceof Map<?, ?> map) {
            return of((String) name, (String) description, (Map<String, ?>) map);
        }
        throw new ValidationException(parameters == null
                ? "Tool must have 'parameters' field"
                : "Tool parameters must be a string or an object");
    }

    public static ToolDefinition fromJson(String json) {
        return fromMap(JsonUtils.parseObject(json));
    }

    /**
     * Converts to the OpenAI tool format.
     * OpenAI expects: { "type": "function", "function": { "name", "description", "parameters" } }
     */
    public Map<String, Object> toOpenAiSchema() {
        return Map.of(
                "type", "function",
                "function", Map.of(
                        "name", name,
                        "description", description,
                        "parameters", parameters
                )
        );
    }

    public Map<String, Object> toMap() {
        return JsonUtils.toMap(this);
    }

    public String toJson() {
        return JsonUtils.toJson(this);
    }
}
