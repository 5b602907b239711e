package com.ai.storeassistant.entity;

import com.ai.storeassistant.conversation.IntentLabel;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * A single line of a session transcript. Written once, never edited.
 */
@Entity
@Table(name = "conversation_message",
        uniqueConstraints = @UniqueConstraint(name = "uk_message_session_seq", columnNames = {"session_id", "sequence_no"}),
        indexes = @Index(name = "idx_message_session", columnList = "session_id"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class ConversationMessage {

    static final int MAX_CONTENT = 4000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "session_id", nullable = false)
    private ChatSession session;

    @Column(name = "sequence_no", nullable = false)
    private int sequenceNo;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private MessageRole role;

    @Column(nullable = false, length = MAX_CONTENT)
    private String content;

    @Enumerated(EnumType.STRING)
    @Column(length = 30)
    private IntentLabel intent;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static String clip(String content) {
        if (content == null) return "";
        return content.length() > MAX_CONTENT ? content.substring(0, MAX_CONTENT) : content;
    }
}
