package com.ai.storeassistant.conversation;

/**
 * What one processed turn hands back to the transport: the reply, whether the
 * conversation goes on, and the session it was recorded under.
 */
public final class TurnResult {

    private final String sessionId;
    private final String responseText;
    private final boolean continueConversation;
    private final SessionMode mode;

    public TurnResult(String sessionId, String responseText, boolean continueConversation, SessionMode mode) {
        this.sessionId = sessionId;
        this.responseText = responseText != null ? responseText : "";
        this.continueConversation = continueConversation;
        this.mode = mode;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getResponseText() {
        return responseText;
    }

    public boolean isContinueConversation() {
        return continueConversation;
    }

    public SessionMode getMode() {
        return mode;
    }
}
