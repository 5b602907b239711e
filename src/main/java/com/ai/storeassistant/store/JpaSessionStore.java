package com.ai.storeassistant.store;

import com.ai.storeassistant.entity.ChatSession;
import com.ai.storeassistant.exception.SessionPersistenceException;
import com.ai.storeassistant.repository.ChatSessionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * JPA-backed session store. Sessions leave {@link #load} detached, with messages and
 * escalation record already fetched, and return through a single merge.
 */
@Component
public class JpaSessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(JpaSessionStore.class);

    private final ChatSessionRepository repository;

    public JpaSessionStore(ChatSessionRepository repository) {
        this.repository = repository;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ChatSession> load(String sessionId) {
        try {
            return repository.findWithConversationBySessionId(sessionId);
        } catch (DataAccessException e) {
            log.error("[{}] Failed to load session", sessionId, e);
            throw new SessionPersistenceException(sessionId, "Could not load session", e);
        }
    }

    @Override
    @Transactional
    public ChatSession save(ChatSession session) {
        try {
            ChatSession saved = repository.saveAndFlush(session);
            log.debug("[{}] Saved session mode={} messages={}", session.getSessionId(),
                    saved.getMode(), saved.getMessages().size());
            return saved;
        } catch (DataAccessException e) {
            log.error("[{}] Failed to save session", session.getSessionId(), e);
            throw new SessionPersistenceException(session.getSessionId(), "Could not save session", e);
        }
    }
}
