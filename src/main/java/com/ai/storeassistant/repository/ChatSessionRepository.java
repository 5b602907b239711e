package com.ai.storeassistant.repository;

import com.ai.storeassistant.entity.ChatSession;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ChatSessionRepository extends JpaRepository<ChatSession, String> {

    @EntityGraph(attributePaths = {"messages", "escalation"})
    Optional<ChatSession> findWithConversationBySessionId(String sessionId);
}
