package com.deepansh.conversation.llm;

import com.deepansh.conversation.config.RequestFactoryCache;
import com.deepansh.conversation.exception.LlmConnectionException;
import com.deepansh.conversation.exception.ToolCallException;
import com.deepansh.conversation.model.Message;
import com.deepansh.conversation.model.RequestConfig;
import com.deepansh.conversation.model.ToolCall;
import com.deepansh.conversation.model.Usage;
import com.deepansh.conversation.tool.ToolDefinition;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible provider adapter. Works with OpenAI, Groq, Gemini's OpenAI endpoint and
 * any other {@code /chat/completions} server.
 *
 * Error handling strategy:
 *
 * | Error                  | Action                                              |
 * |------------------------|-----------------------------------------------------|
 * | 4xx / 5xx              | LlmConnectionException carrying status and body     |
 * | network error/timeout  | LlmConnectionException                              |
 * | no choices in body     | LlmConnectionException                              |
 * | malformed tool call    | ToolCallException carrying the exchange's usage     |
 *
 * Nothing is retried here; the first failure is surfaced to the caller.
 */
@Slf4j
public class GenericLlmProvider implements LlmProvider {

    private static final String SCHEMA_NAME = "structured_output";

    private final LlmProviderProperties props;
    private final ObjectMapper objectMapper;
    private final String providerName;
    private final RestClient.Builder restClientBuilder;
    private final RequestFactoryCache requestFactories;
    private final RestClient restClient;

    public GenericLlmProvider(LlmProviderProperties props,
                              ObjectMapper objectMapper,
                              String providerName,
                              RestClient.Builder restClientBuilder,
                              RequestFactoryCache requestFactories) {
        this.props = props;
        this.objectMapper = objectMapper;
        this.providerName = providerName;
        this.restClientBuilder = restClientBuilder;
        this.requestFactories = requestFactories;
        this.restClient = restClientBuilder.clone()
                .baseUrl(props.getBaseUrl())
                .defaultHeader("Authorization", "Bearer " + props.getApiKey())
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    @Override
    public ChatCompletion completeChat(ChatCompletionRequest request) {
        Map<String, Object> requestBody = buildRequestBody(request);

        log.debug("Sending {} messages and {} tools to {} [model={}]",
                request.getMessages().size(), request.getTools().size(), providerName, request.getModel());

        Map<String, Object> response;
        try {
            response = restClient.post()
                    .uri("/chat/completions")
                    .body(requestBody)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (req, res) -> {
                        String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        int status = res.getStatusCode().value();
                        log.error("{} {} [model={}]: {}", providerName, status, request.getModel(), body);
                        throw new LlmConnectionException(
                                "API Error [" + providerName + "] (" + status + "): " + body, status, null);
                    })
                    .body(new ParameterizedTypeReference<>() {});
        } catch (ResourceAccessException e) {
            log.error("{} unreachable: {}", providerName, e.getMessage());
            throw new LlmConnectionException("Request to provider '" + providerName + "' failed: "
                    + e.getMessage(), e);
        }

        if (response == null) {
            throw new LlmConnectionException(providerName + " returned an empty body");
        }
        return parseResponse(response);
    }

    @Override
    public boolean supportsStructuredOutput(String model) {
        return props.isStructuredOutput();
    }

    /**
     * @throws com.deepansh.conversation.exception.ValidationException if a base url is overridden
     *         without an api key, or the timeout is out of range
     */
    @Override
    public LlmProvider withOverrides(ProviderOverrides overrides) {
        LlmProviderProperties overridden = props.withOverrides(overrides);
        RestClient.Builder builder = restClientBuilder.clone();
        if (overrides.timeout() != null) {
            builder.requestFactory(requestFactories.forTimeout(overrides.timeout()));
        }
        return new GenericLlmProvider(overridden, objectMapper, providerName, builder, requestFactories);
    }

    private Map<String, Object> buildRequestBody(ChatCompletionRequest request) {
        List<Map<String, Object>> formattedMessages = request.getMessages().stream()
                .map(this::formatMessage)
                .toList();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", request.getModel());
        body.put("messages", formattedMessages);

        // Provider defaults first, request options on top
        RequestConfig config = request.getConfig() != null ? request.getConfig() : RequestConfig.empty();
        if (props.getTemperature() != null) {
            body.put("temperature", props.getTemperature());
        }
        if (props.getMaxTokens() != null) {
            body.put("max_tokens", props.getMaxTokens());
        }
        body.putAll(config.toMap());

        if (request.hasTools()) {
            body.put("tools", request.getTools().stream().map(ToolDefinition::toOpenAiSchema).toList());
            body.put("tool_choice", "auto");
        }

        if (request.getResponseFormat() == ResponseFormat.JSON) {
            body.put("response_format", Map.of("type", "json_object"));
        } else if (request.getResponseFormat() == ResponseFormat.JSON_SCHEMA) {
            body.put("response_format", Map.of(
                    "type", "json_schema",
                    "json_schema", Map.of("name", SCHEMA_NAME, "schema", request.getSchema())));
        }

        return body;
    }

    private Map<String, Object> formatMessage(Message msg) {
        Map<String, Object> m = new HashMap<>();
        m.put("role", msg.getRole().name());
        m.put("content", msg.getContent());

        if (msg.getRole() == Message.Role.tool) {
            m.put("tool_call_id", msg.getToolCallId());
        } else if (msg.hasToolCalls()) {
            // The assistant turn that made tool calls must carry them again, otherwise
            // the vendor cannot correlate the tool results that follow.
            m.put("tool_calls", msg.getToolCalls().stream()
                    .map(tc -> {
                        Map<String, Object> tcMap = new HashMap<>();
                        tcMap.put("id", tc.getId());
                        tcMap.put("type", "function");

                        Map<String, Object> fn = new HashMap<>();
                        fn.put("name", tc.getName());
                        fn.put("arguments", tc.argumentsAsJson());
                        tcMap.put("function", fn);
                        return tcMap;
                    })
                    .toList());
        }
        return m;
    }

    @SuppressWarnings("unchecked")
    private ChatCompletion parseResponse(Map<String, Object> response) {
        List<Map<String, Object>> choices = (List<Map<String, Object>>) response.get("choices");
        if (choices == null || choices.isEmpty()) {
            throw new LlmConnectionException(providerName + " returned no choices in response");
        }

        Usage usage = Usage.empty();
        Map<String, Object> usageMap = (Map<String, Object>) response.get("usage");
        if (usageMap != null) {
            int promptTokens = tokenCount(usageMap, "prompt_tokens");
            int completionTokens = tokenCount(usageMap, "completion_tokens");
            Object total = usageMap.get("total_tokens");
            usage = Usage.of(promptTokens, completionTokens,
                    total instanceof Number number ? number.intValue() : null);
            log.debug("Token usage: prompt={} completion={} total={}",
                    promptTokens, completionTokens, usage.getTotalTokens());
        }

        Map<String, Object> choice       = choices.get(0);
        Map<String, Object> message      = (Map<String, Object>) choice.get("message");
        String              finishReason = (String) choice.get("finish_reason");

        log.debug("{} finish_reason: {}", providerName, finishReason);

        if (message == null) {
            throw new LlmConnectionException(providerName + " returned a choice without a message");
        }

        List<ToolCall> toolCalls = new ArrayList<>();
        List<Map<String, Object>> rawCalls = (List<Map<String, Object>>) message.get("tool_calls");
        if (rawCalls != null) {
            for (Map<String, Object> raw : rawCalls) {
                Map<String, Object> function = (Map<String, Object>) raw.get("function");
                String name = function != null && function.get("name") instanceof String n ? n : null;
                String id = raw.get("id") instanceof String i ? i : null;
                if (id == null || id.isBlank() || name == null || name.isBlank()) {
                    log.warn("{} returned an incomplete tool call [id={}, name={}]", providerName, id, name);
                    throw new ToolCallException(providerName + " returned a tool call without "
                            + (id == null || id.isBlank() ? "an id" : "a function name"), usage);
                }
                toolCalls.add(ToolCall.of(id, name,
                        parseArguments(name, function.get("arguments"), usage)));
            }
        }

        return ChatCompletion.builder()
                .content((String) message.get("content"))
                .finishReason(finishReason)
                .usage(usage)
                .toolCalls(toolCalls)
                .responseId((String) response.get("id"))
                .build();
    }

    // Explicit nulls count as absent
    private static int tokenCount(Map<String, Object> usageMap, String key) {
        return usageMap.get(key) instanceof Number number ? number.intValue() : 0;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> parseArguments(String toolName, Object arguments, Usage usage) {
        if (arguments == null) {
            return Map.of();
        }
        if (arguments instanceof Map) {
            return (Map<String, Object>) arguments;
        }
        String json = arguments.toString();
        if (json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<>() {});
        } catch (JsonProcessingException e) {
            throw new ToolCallException("Failed to parse arguments of tool '" + toolName + "' from "
                    + providerName + ": " + json, usage);
        }
    }
}
