package com.deepansh.conversation.core;

import com.deepansh.conversation.exception.StructuredOutputException;
import com.deepansh.conversation.exception.ValidationException;
import com.deepansh.conversation.llm.ChatCompletion;
import com.deepansh.conversation.llm.ChatCompletionRequest;
import com.deepansh.conversation.llm.LlmProvider;
import com.deepansh.conversation.llm.ModelSpec;
import com.deepansh.conversation.llm.ResponseFormat;
import com.deepansh.conversation.model.MessageCollection;
import com.deepansh.conversation.model.RequestConfig;
import com.deepansh.conversation.model.StructuredResponse;
import com.deepansh.conversation.util.JsonUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectReader;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Completion constrained to JSON output, optionally validated by the vendor against a schema.
 *
 * The reply is parsed exactly once. A reply that is not valid JSON raises
 * {@link StructuredOutputException} carrying the raw text; nothing is retried.
 */
@Slf4j
public class StructuredCompletionBuilder extends CompletionBuilder<StructuredCompletionBuilder> {

    // Models often wrap JSON in a Markdown fence despite JSON mode
    private static final Pattern CODE_FENCE = Pattern.compile("^```(?:json)?\\s*(.*?)\\s*```$", Pattern.DOTALL);

    private static final ObjectReader STRICT_READER = JsonUtils.objectMapper()
            .readerFor(Object.class)
            .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private ResponseFormat format = ResponseFormat.JSON;
    private Map<String, Object> schema;

    public StructuredCompletionBuilder(LlmProvider provider, ModelSpec modelSpec, RequestConfig defaults) {
        super(provider, modelSpec, defaults);
    }

    /**
     * Sets the JSON Schema the output must follow and switches to {@code json_schema} format.
     *
     * @throws ValidationException if {@code schemaJson} is not a JSON object
     */
    public StructuredCompletionBuilder withSchema(String schemaJson) {
        Map<String, Object> parsed;
        try {
            parsed = JsonUtils.parseObject(schemaJson);
        } catch (ValidationException e) {
            throw new ValidationException("Invalid JSON schema: " + e.getMessage(), e);
        }
        return withSchema(parsed);
    }

    public StructuredCompletionBuilder withSchema(Map<String, ?> schema) {
        if (schema == null) {
            throw new ValidationException("Schema must not be null");
        }
        this.schema = Collections.unmodifiableMap(JsonUtils.copyOf(schema));
        this.format = ResponseFormat.JSON_SCHEMA;
        return this;
    }

    /** @param format {@code json} or {@code json_schema} */
    public StructuredCompletionBuilder withFormat(String format) {
        return withFormat(ResponseFormat.parse(format));
    }

    public StructuredCompletionBuilder withFormat(ResponseFormat format) {
        if (format == null) {
            throw new ValidationException("Format must not be null");
        }
        this.format = format;
        return this;
    }

    public ResponseFormat getFormat() {
        return format;
    }

    public Map<String, Object> getSchema() {
        return schema;
    }

    /**
     * @throws ValidationException       if {@code json_schema} was requested without a schema
     * @throws StructuredOutputException if the model cannot produce structured output, or its
     *                                   reply is not valid JSON
     */
    public StructuredResponse complete(MessageCollection messages) {
        if (format == ResponseFormat.JSON_SCHEMA && schema == null) {
            throw new ValidationException("Format 'json_schema' requires a schema; call withSchema() first");
        }
        if (!provider.supportsStructuredOutput(modelSpec.model())) {
            throw new StructuredOutputException("Model " + modelSpec + " does not support structured output");
        }

        ChatCompletion completion = dispatch(messages, ChatCompletionRequest.builder()
                .responseFormat(format)
                .schema(format == ResponseFormat.JSON_SCHEMA ? schema : null));

        String raw = completion.getContent() != null ? completion.getContent() : "";
        Object structured = completion.getStructuredValue() != null
                ? completion.getStructuredValue()
                : parse(raw, completion);

        return new StructuredResponse(raw, structured, completion.getUsage(), modelSpec.toString(),
                completion.getFinishReason());
    }

    private Object parse(String raw, ChatCompletion completion) {
        String json = stripCodeFence(raw);
        if (json.isEmpty()) {
            log.warn("{} returned empty content for a structured completion", modelSpec);
            throw new StructuredOutputException("Model returned empty content; expected JSON",
                    raw, completion.getUsage(), null);
        }
        try {
            return STRICT_READER.readValue(json);
        } catch (JsonProcessingException e) {
            log.warn("{} returned content that is not valid JSON: {}", modelSpec, e.getOriginalMessage());
            throw new StructuredOutputException("Failed to parse structured output: " + e.getOriginalMessage(),
                    raw, completion.getUsage(), e);
        }
    }

    static String stripCodeFence(String content) {
        String trimmed = content.trim();
        Matcher matcher = CODE_FENCE.matcher(trimmed);
        return matcher.matches() ? matcher.group(1) : trimmed;
    }
}
