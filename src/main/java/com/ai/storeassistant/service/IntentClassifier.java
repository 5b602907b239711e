package com.ai.storeassistant.service;

import com.ai.storeassistant.conversation.IntentResult;
import com.ai.storeassistant.exception.AdapterUnavailableException;

import java.util.List;

/**
 * Labels a visitor message with one intent from the closed set.
 */
public interface IntentClassifier {

    /**
     * @param recentHistory prior message texts, oldest first, newest last; may be empty
     * @param userText      the message being classified
     * @throws AdapterUnavailableException when no label can be produced
     */
    IntentResult classify(List<String> recentHistory, String userText);
}
