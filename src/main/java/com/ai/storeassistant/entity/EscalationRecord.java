package com.ai.storeassistant.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "escalation_record", indexes = {
    @Index(name = "idx_escalation_inquiry_id", columnList = "inquiry_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EscalationRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "session_id", nullable = false, unique = true)
    private ChatSession session;

    @Column(name = "client_name")
    private String clientName;

    @Column(name = "client_email")
    private String clientEmail;

    /** The user text that asked for a person. */
    @Column(length = 4000)
    private String query;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private EscalationStatus status = EscalationStatus.COLLECTING;

    @Column(name = "inquiry_id", length = 40)
    private String inquiryId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "handed_off_at")
    private Instant handedOffAt;

    public boolean isHandedOff() {
        return status == EscalationStatus.HANDED_OFF;
    }
}
