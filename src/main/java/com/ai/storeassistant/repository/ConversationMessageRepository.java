package com.ai.storeassistant.repository;

import com.ai.storeassistant.entity.ConversationMessage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ConversationMessageRepository extends JpaRepository<ConversationMessage, Long> {

    List<ConversationMessage> findBySession_SessionIdOrderBySequenceNoAsc(String sessionId);
}
