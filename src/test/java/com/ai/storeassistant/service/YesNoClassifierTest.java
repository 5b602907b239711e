package com.ai.storeassistant.service;

import com.ai.storeassistant.conversation.YesNoResult;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class YesNoClassifierTest {

    private final YesNoClassifier classifier = new YesNoClassifier();

    @Test
    public void shouldReadShortAnswers() {
        assertEquals(YesNoResult.YES, classifier.classify("yes"));
        assertEquals(YesNoResult.YES, classifier.classify("Sure!"));
        assertEquals(YesNoResult.YES, classifier.classify("yes please, go ahead"));
        assertEquals(YesNoResult.NO, classifier.classify("No thanks."));
        assertEquals(YesNoResult.NO, classifier.classify("nope"));
    }

    @Test
    public void shouldLeaveMixedOrUnrelatedRepliesUnknown() {
        assertEquals(YesNoResult.UNKNOWN, classifier.classify("yes and no"));
        assertEquals(YesNoResult.UNKNOWN, classifier.classify("What are your hours?"));
        assertEquals(YesNoResult.UNKNOWN, classifier.classify(""));
        assertEquals(YesNoResult.UNKNOWN, classifier.classify(null));
        assertEquals(YesNoResult.UNKNOWN,
                classifier.classify("ok but first tell me whether the backpacks come in blue"));
    }
}
