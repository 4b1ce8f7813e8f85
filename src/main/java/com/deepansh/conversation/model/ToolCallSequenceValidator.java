package com.deepansh.conversation.model;

import com.deepansh.conversation.exception.ToolCallException;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Checks that a conversation follows the tool-calling protocol.
 *
 * Every tool result must answer a call of the most recent assistant tool-call turn, in the
 * order the calls were issued, exactly once. No other message may appear while calls of
 * that turn are still unanswered.
 */
public final class ToolCallSequenceValidator {

    private ToolCallSequenceValidator() {
    }

    /**
     * Validates a conversation that is about to be sent.
     *
     * @throws ToolCallException on any ordering violation, or if calls are still unanswered
     */
    public static void validate(List<Message> messages) {
        Deque<String> pending = scan(messages);
        if (!pending.isEmpty()) {
            throw new ToolCallException("Conversation ends with " + pending.size()
                    + " unanswered tool call(s) " + pending
                    + "; append a tool result for each before completing");
        }
    }

    /**
     * Ids of the calls of the latest tool-call turn that still await a result, in issue order.
     *
     * @throws ToolCallException if the messages before that point already break the protocol
     */
    public static List<String> pendingToolCallIds(List<Message> messages) {
        return List.copyOf(scan(messages));
    }

    private static Deque<String> scan(List<Message> messages) {
        Deque<String> pending = new ArrayDeque<>();
        for (int i = 0; i < messages.size(); i++) {
            Message message = messages.get(i);

            if (message.getRole() == Message.Role.tool) {
                String callId = message.getToolCallId();
                if (pending.isEmpty()) {
                    throw new ToolCallException("Tool result at index " + i + " for call '" + callId
                            + "' is not preceded by the assistant turn that requested it;"
                            + " replay the response with fromResponse() first");
                }
                if (!callId.equals(pending.peekFirst())) {
                    throw new ToolCallException(pending.contains(callId)
                            ? "Tool result at index " + i + " for call '" + callId
                                    + "' is out of order; expected '" + pending.peekFirst() + "'"
                            : "Tool result at index " + i + " answers unknown call '" + callId
                                    + "'; awaiting " + pending);
                }
                pending.removeFirst();
                continue;
            }

            if (!pending.isEmpty()) {
                throw new ToolCallException("Message at index " + i + " (" + message.getRole()
                        + ") arrives while tool call(s) " + pending + " are unanswered");
            }
            if (message.hasToolCalls()) {
                for (ToolCall call : message.getToolCalls()) {
                    if (pending.contains(call.getId())) {
                        throw new ToolCallException("Duplicate tool call id '" + call.getId()
                                + "' in assistant turn at index " + i);
                    }
                    pending.addLast(call.getId());
                }
            }
        }
        return pending;
    }
}
