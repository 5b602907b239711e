package com.ai.storeassistant.support;

import com.ai.storeassistant.entity.ChatSession;
import com.ai.storeassistant.entity.ConversationMessage;
import com.ai.storeassistant.entity.EscalationRecord;
import com.ai.storeassistant.exception.SessionPersistenceException;
import com.ai.storeassistant.store.SessionStore;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Session store for engine tests. Hands out and keeps deep copies, so a caller only
 * changes what is stored by calling {@link #save}.
 */
public class InMemorySessionStore implements SessionStore {

    private final ConcurrentHashMap<String, ChatSession> sessions = new ConcurrentHashMap<>();
    private final AtomicInteger failingSaves = new AtomicInteger();
    private final AtomicInteger saves = new AtomicInteger();

    @Override
    public Optional<ChatSession> load(String sessionId) {
        ChatSession stored = sessions.get(sessionId);
        return stored == null ? Optional.empty() : Optional.of(copy(stored));
    }

    @Override
    public ChatSession save(ChatSession session) {
        if (failingSaves.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new SessionPersistenceException(session.getSessionId(), "simulated write failure", null);
        }
        ChatSession stored = copy(session);
        stored.setVersion(session.getVersion() == null ? 0L : session.getVersion() + 1);
        sessions.put(stored.getSessionId(), stored);
        saves.incrementAndGet();
        return copy(stored);
    }

    /** The next {@code count} saves fail. */
    public void failNextSaves(int count) {
        failingSaves.set(count);
    }

    public ChatSession stored(String sessionId) {
        ChatSession stored = sessions.get(sessionId);
        return stored == null ? null : copy(stored);
    }

    public int saveCount() {
        return saves.get();
    }

    public int size() {
        return sessions.size();
    }

    private static ChatSession copy(ChatSession source) {
        ChatSession target = ChatSession.builder()
                .sessionId(source.getSessionId())
                .mode(source.getMode())
                .escalationOffered(source.isEscalationOffered())
                .initialIntent(source.getInitialIntent())
                .clientName(source.getClientName())
                .clientEmail(source.getClientEmail())
                .createdAt(source.getCreatedAt())
                .lastActivityAt(source.getLastActivityAt())
                .version(source.getVersion())
                .build();
        for (ConversationMessage m : source.getMessages()) {
            target.getMessages().add(ConversationMessage.builder()
                    .id(m.getId())
                    .session(target)
                    .sequenceNo(m.getSequenceNo())
                    .role(m.getRole())
                    .content(m.getContent())
                    .intent(m.getIntent())
                    .createdAt(m.getCreatedAt())
                    .build());
        }
        EscalationRecord e = source.getEscalation();
        if (e != null) {
            target.setEscalation(EscalationRecord.builder()
                    .id(e.getId())
                    .session(target)
                    .clientName(e.getClientName())
                    .clientEmail(e.getClientEmail())
                    .query(e.getQuery())
                    .status(e.getStatus())
                    .inquiryId(e.getInquiryId())
                    .createdAt(e.getCreatedAt())
                    .handedOffAt(e.getHandedOffAt())
                    .build());
        }
        return target;
    }
}
