package com.ai.storeassistant.service;

import com.ai.storeassistant.conversation.IntentLabel;
import com.ai.storeassistant.conversation.IntentResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

public class KeywordIntentClassifierTest {

    private final KeywordIntentClassifier classifier = new KeywordIntentClassifier();

    private IntentLabel label(String text) {
        return classifier.classify(List.of(), text).getLabel();
    }

    @Test
    public void shouldDetectProductInquiries() {
        assertEquals(IntentLabel.PRODUCT_INQUIRY, label("Do you have backpacks in stock?"));
        assertEquals(IntentLabel.PRODUCT_INQUIRY, label("How much is the slim fit t-shirt"));
        assertEquals(IntentLabel.PRODUCT_INQUIRY, label("do you sell umbrellas"));
    }

    @Test
    public void shouldDetectGeneralQuestions() {
        assertEquals(IntentLabel.GENERAL_QUESTION, label("What are your hours?"));
        assertEquals(IntentLabel.GENERAL_QUESTION, label("Where are you located"));
        assertEquals(IntentLabel.GENERAL_QUESTION, label("Do you accept PayPal?"));
    }

    @Test
    public void shouldPreferHumanRequestOverEverythingElse() {
        assertEquals(IntentLabel.HUMAN_REQUEST, label("I want to talk to a person"));
        assertEquals(IntentLabel.HUMAN_REQUEST, label("Can I speak to someone about a price?"));
        assertEquals(IntentLabel.HUMAN_REQUEST, label("get me a human"));
    }

    @Test
    public void shouldLabelSmallTalkAsOther() {
        assertEquals(IntentLabel.OTHER, label("hello"));
        assertEquals(IntentLabel.OTHER, label("thank you!"));
    }

    @Test
    public void shouldReportGibberishAsUndetected() {
        IntentResult result = classifier.classify(List.of("user: hello"), "asdkjh");

        assertFalse(result.isDetected());
        assertEquals(IntentLabel.UNDETECTED, result.getLabel());
        assertFalse(classifier.classify(List.of(), "  ").isDetected());
    }
}
