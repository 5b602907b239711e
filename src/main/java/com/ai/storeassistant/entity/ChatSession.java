package com.ai.storeassistant.entity;

import com.ai.storeassistant.conversation.IntentLabel;
import com.ai.storeassistant.conversation.SessionMode;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One visitor conversation. Owns its ordered messages and, once escalation starts,
 * its escalation record. Closing a session changes its mode; rows are never deleted here.
 */
@Entity
@Table(name = "chat_session")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChatSession {

    @Id
    @Column(name = "session_id", length = 64)
    private String sessionId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private SessionMode mode = SessionMode.IDLE;

    /** Set when the last reply offered a hand-off after an undetected message. */
    @Column(name = "escalation_offered", nullable = false)
    @Builder.Default
    private boolean escalationOffered = false;

    @Enumerated(EnumType.STRING)
    @Column(name = "initial_intent", length = 30)
    private IntentLabel initialIntent;

    @Column(name = "client_name")
    private String clientName;

    @Column(name = "client_email")
    private String clientEmail;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "last_activity_at", nullable = false)
    private Instant lastActivityAt;

    @Version
    private Long version;

    @OneToMany(mappedBy = "session", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("sequenceNo ASC")
    @Builder.Default
    private List<ConversationMessage> messages = new ArrayList<>();

    @OneToOne(mappedBy = "session", cascade = CascadeType.ALL, orphanRemoval = true)
    private EscalationRecord escalation;

    public static ChatSession open(String sessionId, Instant now) {
        return ChatSession.builder()
                .sessionId(sessionId)
                .mode(SessionMode.IDLE)
                .createdAt(now)
                .lastActivityAt(now)
                .build();
    }

    public ConversationMessage appendMessage(MessageRole role, String content, IntentLabel intent, Instant at) {
        ConversationMessage message = ConversationMessage.builder()
                .session(this)
                .sequenceNo(messages.size() + 1)
                .role(role)
                .content(ConversationMessage.clip(content))
                .intent(intent)
                .createdAt(at)
                .build();
        messages.add(message);
        lastActivityAt = at;
        return message;
    }

    public EscalationRecord startEscalation(String query, Instant now) {
        if (escalation == null) {
            escalation = EscalationRecord.builder()
                    .session(this)
                    .query(ConversationMessage.clip(query))
                    .status(EscalationStatus.COLLECTING)
                    .createdAt(now)
                    .build();
        }
        return escalation;
    }
}
