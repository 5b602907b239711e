package com.ai.storeassistant.exception;

/**
 * The session store failed to read or commit a session. Fatal for the turn.
 */
public class SessionPersistenceException extends RuntimeException {

    private final String sessionId;

    public SessionPersistenceException(String sessionId, String message, Throwable cause) {
        super(message, cause);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
