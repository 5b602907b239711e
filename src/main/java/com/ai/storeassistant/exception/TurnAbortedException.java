package com.ai.storeassistant.exception;

public class TurnAbortedException extends RuntimeException {

    public TurnAbortedException(String sessionId) {
        super("Turn aborted before commit for session " + sessionId);
    }
}
