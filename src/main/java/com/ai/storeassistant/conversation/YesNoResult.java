package com.ai.storeassistant.conversation;

/**
 * Answer to a yes/no offer made by the assistant.
 */
public enum YesNoResult {
    YES,
    NO,
    UNKNOWN
}
