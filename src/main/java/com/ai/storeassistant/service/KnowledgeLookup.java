package com.ai.storeassistant.service;

import com.ai.storeassistant.dto.KnowledgeAnswer;
import com.ai.storeassistant.exception.AdapterUnavailableException;

/**
 * General store facts (hours, location, contact and the like) keyed by topic.
 */
public interface KnowledgeLookup {

    /**
     * @throws AdapterUnavailableException when the facts cannot be read
     */
    KnowledgeAnswer lookup(String query);
}
