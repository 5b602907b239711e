package com.ai.storeassistant.service;

import com.ai.storeassistant.conversation.SessionMode;
import com.ai.storeassistant.entity.ChatSession;
import com.ai.storeassistant.entity.EscalationRecord;
import com.ai.storeassistant.entity.EscalationStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class EscalationCoordinatorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private ResponsePhrases phrases;
    private EscalationCoordinator coordinator;
    private ChatSession session;

    @BeforeEach
    public void setUp() {
        this.phrases = new ResponsePhrases();
        this.coordinator = new EscalationCoordinator(phrases);
        this.session = ChatSession.open("s1", NOW);
        session.setMode(SessionMode.ESCALATING);
    }

    @Test
    public void shouldOpenRecordOnceAndAskForName() {
        assertEquals(phrases.askName(), coordinator.begin(session, "speak to someone", NOW));
        EscalationRecord record = session.getEscalation();
        assertEquals("speak to someone", record.getQuery());
        assertEquals(EscalationStatus.COLLECTING, record.getStatus());

        coordinator.begin(session, "something else", NOW.plusSeconds(60));
        assertSame(record, session.getEscalation());
        assertEquals("speak to someone", session.getEscalation().getQuery());
    }

    @Test
    public void shouldFillNameBeforeEmail() {
        coordinator.begin(session, "help", NOW);

        String reply = coordinator.advance(session, "maria@example.com", NOW);

        // the first answer is always taken as the name
        assertEquals(phrases.askEmail("maria@example.com"), reply);
        assertEquals("maria@example.com", session.getEscalation().getClientName());
        assertNull(session.getEscalation().getClientEmail());
        assertEquals(SessionMode.ESCALATING, session.getMode());
    }

    @Test
    public void shouldStripNameLeadIn() {
        coordinator.begin(session, "help", NOW);

        coordinator.advance(session, "My name is Maria Lopez.", NOW);

        assertEquals("Maria Lopez", session.getEscalation().getClientName());
    }

    @Test
    public void shouldKeepAskingUntilEmailLooksValid() {
        coordinator.begin(session, "help", NOW);
        coordinator.advance(session, "Maria", NOW);

        assertEquals(phrases.invalidEmail(), coordinator.advance(session, "not-an-email", NOW));
        assertEquals(phrases.invalidEmail(), coordinator.advance(session, "maria @ example.com", NOW));
        assertEquals(SessionMode.ESCALATING, session.getMode());

        String reply = coordinator.advance(session, "sure, it's maria@example.com.", NOW);

        assertEquals(SessionMode.HUMAN_HANDOFF, session.getMode());
        assertTrue(reply.contains("INQ-" + NOW.getEpochSecond()));
        assertTrue(reply.contains("maria@example.com"));
        assertTrue(reply.contains("s1"));
        assertTrue(session.getEscalation().isHandedOff());
        assertEquals("maria@example.com", session.getClientEmail());
        assertEquals("Maria", session.getClientName());
    }

    @Test
    public void shouldRefuseToAdvanceOutsideEscalating() {
        session.setMode(SessionMode.IDLE);

        assertThrows(IllegalStateException.class, () -> coordinator.advance(session, "Maria", NOW));
        assertNull(session.getEscalation());
    }

    @Test
    public void shouldExtractNamesAndEmails() {
        assertEquals("Maria", EscalationCoordinator.extractName("  Maria  "));
        assertEquals("Sam", EscalationCoordinator.extractName("I'm Sam!"));
        assertEquals("I am", EscalationCoordinator.extractName("I am"));
        assertNull(EscalationCoordinator.extractName("   "));

        assertEquals("a@b", EscalationCoordinator.extractEmail("a@b"));
        assertEquals("maria@example.com", EscalationCoordinator.extractEmail("email: maria@example.com"));
        assertNull(EscalationCoordinator.extractEmail("maria at example dot com"));
        assertNull(EscalationCoordinator.extractEmail(""));
        assertFalse(EscalationCoordinator.isEmailShaped("a@@b"));
        assertFalse(EscalationCoordinator.isEmailShaped(null));
    }
}
