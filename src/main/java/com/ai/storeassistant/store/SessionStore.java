package com.ai.storeassistant.store;

import com.ai.storeassistant.entity.ChatSession;
import com.ai.storeassistant.exception.SessionPersistenceException;

import java.util.Optional;

/**
 * Durable home of chat sessions. A loaded session is a private working copy: changes
 * reach the store only through {@link #save}, which commits the whole session at once.
 */
public interface SessionStore {

    /**
     * @throws SessionPersistenceException when the store cannot be read
     */
    Optional<ChatSession> load(String sessionId);

    /**
     * Writes mode, messages and escalation record in one unit.
     *
     * @throws SessionPersistenceException when nothing could be committed
     */
    ChatSession save(ChatSession session);
}
