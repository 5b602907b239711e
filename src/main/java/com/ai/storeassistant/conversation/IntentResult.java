package com.ai.storeassistant.conversation;

/**
 * Outcome of one classifier call: a label from the closed set plus whether anything was detected.
 * An undetected result always carries {@link IntentLabel#UNDETECTED}.
 */
public final class IntentResult {

    private final IntentLabel label;
    private final boolean detected;

    private IntentResult(IntentLabel label, boolean detected) {
        this.label = label;
        this.detected = detected;
    }

    public IntentLabel getLabel() {
        return label;
    }

    public boolean isDetected() {
        return detected;
    }

    public static IntentResult of(IntentLabel label) {
        if (label == null || label == IntentLabel.UNDETECTED) {
            return undetected();
        }
        return new IntentResult(label, true);
    }

    public static IntentResult undetected() {
        return new IntentResult(IntentLabel.UNDETECTED, false);
    }

    @Override
    public String toString() {
        return "IntentResult{" + label.getCode() + ", detected=" + detected + "}";
    }
}
