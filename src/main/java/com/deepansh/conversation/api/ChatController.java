package com.deepansh.conversation.api;

import com.deepansh.conversation.core.Llm;
import com.deepansh.conversation.core.LlmFactory;
import com.deepansh.conversation.core.StructuredCompletionBuilder;
import com.deepansh.conversation.exception.ValidationException;
import com.deepansh.conversation.llm.ProviderOverrides;
import com.deepansh.conversation.model.ChatRequest;
import com.deepansh.conversation.model.MessageCollection;
import com.deepansh.conversation.model.Response;
import com.deepansh.conversation.model.StructuredChatRequest;
import com.deepansh.conversation.model.StructuredResponse;
import com.deepansh.conversation.model.ToolChatRequest;
import com.deepansh.conversation.model.ToolResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Stateless chat endpoints. The caller sends the whole conversation on every request.
 *
 * POST /api/v1/chat/complete
 * POST /api/v1/chat/structured
 * POST /api/v1/chat/tools
 *   Tool calls are returned, never executed. Append the assistant turn and the tool
 *   results to the conversation and call /tools again.
 *
 * GET /api/v1/chat/health
 */
@RestController
@RequestMapping("/api/v1/chat")
@RequiredArgsConstructor
@Slf4j
public class ChatController {

    private final LlmFactory llmFactory;

    @PostMapping("/complete")
    public ResponseEntity<Response> complete(@Valid @RequestBody ChatRequest request) {
        log.info("Chat completion request [model={}, messages={}]",
                request.getModel(), request.getMessages().size());

        Llm llm = session(request);
        return ResponseEntity.ok(llm.plain()
                .withOptions(request.getOptions())
                .complete(MessageCollection.fromMaps(request.getMessages())));
    }

    @PostMapping("/structured")
    public ResponseEntity<StructuredResponse> structured(@Valid @RequestBody StructuredChatRequest request) {
        log.info("Structured completion request [model={}, messages={}, format={}]",
                request.getModel(), request.getMessages().size(), request.getFormat());

        StructuredCompletionBuilder builder = session(request).structured()
                .withOptions(request.getOptions());
        applySchema(builder, request.getSchema());
        if (request.getFormat() != null) {
            builder.withFormat(request.getFormat());
        }
        return ResponseEntity.ok(builder.complete(MessageCollection.fromMaps(request.getMessages())));
    }

    @PostMapping("/tools")
    public ResponseEntity<ToolResponse> tools(@Valid @RequestBody ToolChatRequest request) {
        log.info("Tool completion request [model={}, messages={}, tools={}]",
                request.getModel(), request.getMessages().size(),
                request.getTools() != null ? request.getTools().size() : 0);

        Llm llm = session(request);
        ToolResponse response = llm.withTools()
                .setToolsFromMaps(request.getTools())
                .withOptions(request.getOptions())
                .complete(MessageCollection.fromMaps(request.getMessages()));

        log.info("Tool completion finished [state={}, toolCalls={}]",
                response.getState(), response.getToolCalls().size());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }

    /** Only {@code timeout} may be overridden over HTTP; credentials and endpoints come from configuration. */
    private Llm session(ChatRequest request) {
        ProviderOverrides overrides = ProviderOverrides.fromMap(request.getOptions());
        if (overrides.apiKey() != null || overrides.baseUrl() != null) {
            log.warn("Rejected request overriding provider endpoint or credentials [model={}]", request.getModel());
            throw new ValidationException("api_key and base_url cannot be set per request; configure them under llm.providers");
        }
        String model = request.getModel();
        return model == null || model.isBlank()
                ? llmFactory.create(overrides)
                : llmFactory.create(model, overrides);
    }

    @SuppressWarnings("unchecked")
    private void applySchema(StructuredCompletionBuilder builder, Object schema) {
        if (schema == null) {
            return;
        }
        if (schema instanceof String json) {
            builder.withSchema(json);
        } else if (schema instanceof Map<?, ?> map) {
            builder.withSchema((Map<String, ?>) map);
        } else {
            throw new ValidationException("schema must be a JSON object or a JSON string");
        }
    }
}
