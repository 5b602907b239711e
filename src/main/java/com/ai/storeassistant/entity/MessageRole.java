package com.ai.storeassistant.entity;

public enum MessageRole {
    USER,
    ASSISTANT,
    SYSTEM
}
