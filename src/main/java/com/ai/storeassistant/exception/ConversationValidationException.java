package com.ai.storeassistant.exception;

/**
 * Rejected input. Raised before any session is read or written.
 */
public class ConversationValidationException extends RuntimeException {

    public ConversationValidationException(String message) {
        super(message);
    }
}
