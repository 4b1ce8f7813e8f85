package com.deepansh.conversation.model;

/**
 * Position in the two-phase tool-calling protocol.
 *
 * AWAITING_INITIAL --complete()--> HAS_TOOL_CALLS | TERMINAL
 * HAS_TOOL_CALLS   --replay + one result per call, then complete()--> AWAITING_INITIAL semantics again
 */
public enum ToolCallState {

    /** Conversation is consistent and can be sent. */
    AWAITING_INITIAL,

    /** The model requested tools; results are owed before the next completion. */
    HAS_TOOL_CALLS,

    /** The model answered without requesting tools. */
    TERMINAL
}
