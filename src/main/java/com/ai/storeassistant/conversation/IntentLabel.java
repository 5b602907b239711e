package com.ai.storeassistant.conversation;

import org.apache.commons.lang3.StringUtils;

/**
 * Closed set of intents the classifier may return.
 */
public enum IntentLabel {
    PRODUCT_INQUIRY("product_inquiry"),
    GENERAL_QUESTION("general_question"),
    HUMAN_REQUEST("human_request"),
    OTHER("other"),
    UNDETECTED("undetected");

    private final String code;

    IntentLabel(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /** Unknown or blank codes map to UNDETECTED. */
    public static IntentLabel fromCode(String code) {
        if (StringUtils.isBlank(code)) return UNDETECTED;
        String normalized = code.trim().toLowerCase();
        for (IntentLabel label : values()) {
            if (label.code.equals(normalized) || label.name().equalsIgnoreCase(normalized)) {
                return label;
            }
        }
        return UNDETECTED;
    }
}
