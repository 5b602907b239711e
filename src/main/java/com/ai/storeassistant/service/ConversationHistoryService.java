package com.ai.storeassistant.service;

import com.ai.storeassistant.dto.SessionSnapshotDto;
import com.ai.storeassistant.entity.ChatSession;
import com.ai.storeassistant.entity.ConversationMessage;
import com.ai.storeassistant.entity.EscalationRecord;
import com.ai.storeassistant.repository.ConversationMessageRepository;
import com.ai.storeassistant.store.SessionStore;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Read side of the session store: snapshots and transcripts for the transport and operators.
 */
@Service
public class ConversationHistoryService {

    private final SessionStore sessionStore;
    private final ConversationMessageRepository messageRepository;

    public ConversationHistoryService(SessionStore sessionStore, ConversationMessageRepository messageRepository) {
        this.sessionStore = sessionStore;
        this.messageRepository = messageRepository;
    }

    public Optional<SessionSnapshotDto> getSnapshot(String sessionId) {
        return sessionStore.load(sessionId).map(this::toSnapshot);
    }

    @Transactional(readOnly = true)
    public List<SessionSnapshotDto.Message> getTranscript(String sessionId) {
        return messageRepository.findBySession_SessionIdOrderBySequenceNoAsc(sessionId).stream()
                .map(ConversationHistoryService::toMessage)
                .collect(Collectors.toList());
    }

    private SessionSnapshotDto toSnapshot(ChatSession session) {
        EscalationRecord record = session.getEscalation();
        return SessionSnapshotDto.builder()
                .sessionId(session.getSessionId())
                .mode(session.getMode().name())
                .initialIntent(session.getInitialIntent() != null ? session.getInitialIntent().getCode() : null)
                .clientName(session.getClientName())
                .clientEmail(session.getClientEmail())
                .createdAt(session.getCreatedAt())
                .lastActivityAt(session.getLastActivityAt())
                .escalation(record == null ? null : SessionSnapshotDto.Escalation.builder()
                        .status(record.getStatus().name())
                        .clientName(record.getClientName())
                        .clientEmail(record.getClientEmail())
                        .query(record.getQuery())
                        .inquiryId(record.getInquiryId())
                        .handedOffAt(record.getHandedOffAt())
                        .build())
                .messages(session.getMessages().stream()
                        .map(ConversationHistoryService::toMessage)
                        .collect(Collectors.toList()))
                .build();
    }

    private static SessionSnapshotDto.Message toMessage(ConversationMessage m) {
        return SessionSnapshotDto.Message.builder()
                .sequenceNo(m.getSequenceNo())
                .role(m.getRole().name().toLowerCase())
                .content(m.getContent())
                .intent(m.getIntent() != null ? m.getIntent().getCode() : null)
                .createdAt(m.getCreatedAt())
                .build();
    }
}
