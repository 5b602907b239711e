package com.ai.storeassistant.exception;

/**
 * A lookup capability (classifier, catalog, store knowledge) could not answer.
 */
public class AdapterUnavailableException extends RuntimeException {

    private final String adapter;

    public AdapterUnavailableException(String adapter, String message) {
        super(message);
        this.adapter = adapter;
    }

    public AdapterUnavailableException(String adapter, String message, Throwable cause) {
        super(message, cause);
        this.adapter = adapter;
    }

    public String getAdapter() {
        return adapter;
    }
}
