package com.ai.storeassistant.entity;

/**
 * COLLECTING until both name and email are captured, then HANDED_OFF for good.
 */
public enum EscalationStatus {
    COLLECTING,
    HANDED_OFF
}
