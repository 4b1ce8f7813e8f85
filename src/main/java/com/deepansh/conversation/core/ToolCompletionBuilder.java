package com.deepansh.conversation.core;

import com.deepansh.conversation.exception.ToolCallException;
import com.deepansh.conversation.exception.ValidationException;
import com.deepansh.conversation.llm.ChatCompletion;
import com.deepansh.conversation.llm.ChatCompletionRequest;
import com.deepansh.conversation.llm.LlmProvider;
import com.deepansh.conversation.llm.ModelSpec;
import com.deepansh.conversation.model.MessageCollection;
import com.deepansh.conversation.model.RequestConfig;
import com.deepansh.conversation.model.ToolCall;
import com.deepansh.conversation.model.ToolResponse;
import com.deepansh.conversation.tool.ToolDefinition;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Completion with tools on offer.
 *
 * The caller drives the round trip: on a response with tool calls, replay it with
 * {@link MessageCollection#fromResponse}, append one result per call in the returned order,
 * then call {@link #complete} again. Tools are never executed here.
 */
@Slf4j
public class ToolCompletionBuilder extends CompletionBuilder<ToolCompletionBuilder> {

    // Keyed by name, insertion order is the order tools are sent in
    private final Map<String, ToolDefinition> tools = new LinkedHashMap<>();
    private boolean autoExecute;

    public ToolCompletionBuilder(LlmProvider provider, ModelSpec modelSpec, RequestConfig defaults) {
        super(provider, modelSpec, defaults);
    }

    /**
     * @throws ValidationException if a tool with the same name is already offered
     */
    public ToolCompletionBuilder addTool(ToolDefinition tool) {
        if (tool == null) {
            throw new ValidationException("Tool must not be null");
        }
        if (tools.containsKey(tool.getName())) {
            throw new ValidationException("Duplicate tool name: " + tool.getName());
        }
        tools.put(tool.getName(), tool);
        return this;
    }

    public ToolCompletionBuilder addTool(Map<String, ?> tool) {
        return addTool(ToolDefinition.fromMap(tool));
    }

    /** Replaces the offered tools. On a validation failure the previous set is kept. */
    public ToolCompletionBuilder setTools(Collection<ToolDefinition> newTools) {
        Map<String, ToolDefinition> previous = new LinkedHashMap<>(tools);
        tools.clear();
        try {
            if (newTools != null) {
                newTools.forEach(this::addTool);
            }
        } catch (ValidationException e) {
            tools.clear();
            tools.putAll(previous);
            throw e;
        }
        return this;
    }

    public ToolCompletionBuilder setToolsFromMaps(List<? extends Map<String, ?>> newTools) {
        List<ToolDefinition> definitions = new ArrayList<>();
        if (newTools != null) {
            newTools.forEach(t -> definitions.add(ToolDefinition.fromMap(t)));
        }
        return setTools(definitions);
    }

    /**
     * Reserved for automatic tool execution, which this library does not perform.
     * The flag is only stored; tool calls are always returned to the caller.
     */
    public ToolCompletionBuilder setAutoExecute(boolean autoExecute) {
        this.autoExecute = autoExecute;
        log.debug("autoExecute={} recorded for {}; tool calls are still returned to the caller",
                autoExecute, modelSpec);
        return this;
    }

    public boolean isAutoExecute() {
        return autoExecute;
    }

    public List<ToolDefinition> getTools() {
        return List.copyOf(tools.values());
    }

    /**
     * @return the reply, with zero tool calls when the model answered directly
     * @throws ToolCallException if the conversation breaks the tool-calling order, or the model
     *                           called a tool that was not offered or reused a call id
     */
    public ToolResponse complete(MessageCollection messages) {
        List<ToolDefinition> offered = getTools();
        if (offered.isEmpty()) {
            log.debug("No tools offered to {}; sending a plain completion", modelSpec);
        }

        ChatCompletion completion = dispatch(messages, ChatCompletionRequest.builder().tools(offered));
        checkToolCalls(completion);

        return new ToolResponse(completion.getContent(), completion.getToolCalls(), completion.getUsage(),
                modelSpec.toString(), completion.getFinishReason(), completion.getResponseId());
    }

    private void checkToolCalls(ChatCompletion completion) {
        Set<String> ids = new HashSet<>();
        for (ToolCall call : completion.getToolCalls()) {
            if (!tools.containsKey(call.getName())) {
                log.warn("{} called unknown tool '{}'", modelSpec, call.getName());
                throw new ToolCallException("Model called tool '" + call.getName()
                        + "' which was not offered; offered tools: " + tools.keySet(), completion.getUsage());
            }
            if (!ids.add(call.getId())) {
                log.warn("{} reused tool call id '{}'", modelSpec, call.getId());
                throw new ToolCallException("Duplicate tool call id '" + call.getId() + "' in one response",
                        completion.getUsage());
            }
        }
    }
}
