package com.ai.storeassistant.conversation;

/**
 * Modes of a chat session. Only the conversation engine moves a session between them.
 * INQUIRY is a working mode inside a single turn and is never stored.
 */
public enum SessionMode {
    IDLE,
    INQUIRY,
    ESCALATING,
    HUMAN_HANDOFF,
    CLOSED
}
