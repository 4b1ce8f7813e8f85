package com.deepansh.conversation.core;

import com.deepansh.conversation.exception.ToolCallException;
import com.deepansh.conversation.llm.ChatCompletion;
import com.deepansh.conversation.llm.ChatCompletionRequest;
import com.deepansh.conversation.llm.LlmProvider;
import com.deepansh.conversation.llm.ModelSpec;
import com.deepansh.conversation.model.MessageCollection;
import com.deepansh.conversation.model.RequestConfig;
import com.deepansh.conversation.model.Response;
import lombok.extern.slf4j.Slf4j;

/**
 * Free-text completion: no tools offered, no output format imposed.
 */
@Slf4j
public class PlainCompletionBuilder extends CompletionBuilder<PlainCompletionBuilder> {

    public PlainCompletionBuilder(LlmProvider provider, ModelSpec modelSpec, RequestConfig defaults) {
        super(provider, modelSpec, defaults);
    }

    /**
     * @throws ToolCallException if the provider answers with tool calls although none were offered
     */
    public Response complete(MessageCollection messages) {
        ChatCompletion completion = dispatch(messages, ChatCompletionRequest.builder());
        if (completion.hasToolCalls()) {
            log.warn("{} returned {} tool call(s) to a plain completion", modelSpec, completion.getToolCalls().size());
            throw new ToolCallException("Model returned tool calls although no tools were offered",
                    completion.getUsage());
        }
        return new Response(completion.getContent(), completion.getUsage(), modelSpec.toString(),
                completion.getFinishReason());
    }
}
