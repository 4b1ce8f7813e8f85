package com.deepansh.conversation.model;

import com.deepansh.conversation.exception.ValidationException;
import com.deepansh.conversation.util.JsonUtils;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import lombok.Builder;
import lombok.Value;

import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Generation parameters for one request. Every field is optional; null leaves the
 * provider's default in place.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"temperature", "max_tokens", "top_p", "frequency_penalty", "presence_penalty"})
public class RequestConfig {

    private static final Validator VALIDATOR = Validation.buildDefaultValidatorFactory().getValidator();

    private static final RequestConfig EMPTY = RequestConfig.builder().build();

    @DecimalMin(value = "0.0", message = "temperature must be between 0 and 2")
    @DecimalMax(value = "2.0", message = "temperature must be between 0 and 2")
    Double temperature;

    @JsonProperty("max_tokens")
    @Positive(message = "max_tokens must be greater than 0")
    Integer maxTokens;

    @JsonProperty("top_p")
    @DecimalMin(value = "0.0", message = "top_p must be between 0 and 1")
    @DecimalMax(value = "1.0", message = "top_p must be between 0 and 1")
    Double topP;

    @JsonProperty("frequency_penalty")
    @DecimalMin(value = "-2.0", message = "frequency_penalty must be between -2 and 2")
    @DecimalMax(value = "2.0", message = "frequency_penalty must be between -2 and 2")
    Double frequencyPenalty;

    @JsonProperty("presence_penalty")
    @DecimalMin(value = "-2.0", message = "presence_penalty must be between -2 and 2")
    @DecimalMax(value = "2.0", message = "presence_penalty must be between -2 and 2")
    Double presencePenalty;

    public static RequestConfig empty() {
        return EMPTY;
    }

    /**
     * Reads the snake_case option keys; unknown keys are ignored.
     */
    public static RequestConfig fromMap(Map<String, ?> options) {
        if (options == null || options.isEmpty()) {
            return EMPTY;
        }
        return RequestConfig.builder()
                .temperature(doubleOption(options, "temperature"))
                .maxTokens(intOption(options, "max_tokens"))
                .topP(doubleOption(options, "top_p"))
                .frequencyPenalty(doubleOption(options, "frequency_penalty"))
                .presencePenalty(doubleOption(options, "presence_penalty"))
                .build()
                .validated();
    }

    /**
     * @throws ValidationException listing every out-of-range field
     */
    public RequestConfig validated() {
        Set<ConstraintViolation<RequestConfig>> violations = VALIDATOR.validate(this);
        if (!violations.isEmpty()) {
            throw new ValidationException(violations.stream()
                    .map(ConstraintViolation::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; ")));
        }
        return this;
    }

    /** Fields set on {@code overrides} win; the rest are kept from this config. */
    public RequestConfig merge(RequestConfig overrides) {
        if (overrides == null) {
            return this;
        }
        return toBuilder()
                .temperature(overrides.temperature != null ? overrides.temperature : temperature)
                .maxTokens(overrides.maxTokens != null ? overrides.maxTokens : maxTokens)
                .topP(overrides.topP != null ? overrides.topP : topP)
                .frequencyPenalty(overrides.frequencyPenalty != null ? overrides.frequencyPenalty : frequencyPenalty)
                .presencePenalty(overrides.presencePenalty != null ? overrides.presencePenalty : presencePenalty)
                .build();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return temperature == null && maxTokens == null && topP == null
                && frequencyPenalty == null && presencePenalty == null;
    }

    public Map<String, Object> toMap() {
        return JsonUtils.toMap(this);
    }

    private static Double doubleOption(Map<String, ?> options, String key) {
        Object value = options.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Number number)) {
            throw new ValidationException(key + " must be a number but was '" + value + "'");
        }
        return number.doubleValue();
    }

    private static Integer intOption(Map<String, ?> options, String key) {
        Object value = options.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Number number) || number.doubleValue() != Math.rint(number.doubleValue())) {
            throw new ValidationException(key + " must be an integer but was '" + value + "'");
        }
        return number.intValue();
    }
}
