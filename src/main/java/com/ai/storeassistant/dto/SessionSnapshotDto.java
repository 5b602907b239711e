package com.ai.storeassistant.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Read model of a session for the transport and operators.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionSnapshotDto {

    private String sessionId;
    private String mode;
    private String initialIntent;
    private String clientName;
    private String clientEmail;
    private Instant createdAt;
    private Instant lastActivityAt;
    private Escalation escalation;
    private List<Message> messages;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Message {
        private int sequenceNo;
        private String role;
        private String content;
        private String intent;
        private Instant createdAt;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Escalation {
        private String status;
        private String clientName;
        private String clientEmail;
        private String query;
        private String inquiryId;
        private Instant handedOffAt;
    }
}
