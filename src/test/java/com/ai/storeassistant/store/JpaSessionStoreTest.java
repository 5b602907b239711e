package com.ai.storeassistant.store;

import com.ai.storeassistant.conversation.IntentLabel;
import com.ai.storeassistant.conversation.SessionMode;
import com.ai.storeassistant.entity.ChatSession;
import com.ai.storeassistant.entity.EscalationStatus;
import com.ai.storeassistant.entity.MessageRole;
import com.ai.storeassistant.exception.SessionPersistenceException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Runs every store call in its own transaction, the way the engine uses it.
 */
@DataJpaTest
@Import(JpaSessionStore.class)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
public class JpaSessionStoreTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    @Autowired
    private JpaSessionStore store;

    @Test
    public void shouldReturnEmptyForUnknownSession() {
        assertTrue(store.load("missing-" + UUID.randomUUID()).isEmpty());
    }

    @Test
    public void shouldPersistNewSessionWithMessages() {
        String id = UUID.randomUUID().toString();
        ChatSession session = ChatSession.open(id, T0);
        session.appendMessage(MessageRole.USER, "hello", IntentLabel.OTHER, T0);
        session.appendMessage(MessageRole.ASSISTANT, "Happy to help!", IntentLabel.OTHER, T0.plusSeconds(1));
        session.setInitialIntent(IntentLabel.OTHER);

        store.save(session);

        ChatSession loaded = store.load(id).orElseThrow();
        assertEquals(SessionMode.IDLE, loaded.getMode());
        assertEquals(IntentLabel.OTHER, loaded.getInitialIntent());
        assertEquals(0L, loaded.getVersion());
        assertEquals(2, loaded.getMessages().size());
        assertEquals("hello", loaded.getMessages().get(0).getContent());
        assertEquals(2, loaded.getMessages().get(1).getSequenceNo());
        assertEquals(T0.plusSeconds(1), loaded.getLastActivityAt());
    }

    @Test
    public void shouldMergeAppendedMessagesAndEscalationInOneSave() {
        String id = UUID.randomUUID().toString();
        ChatSession session = ChatSession.open(id, T0);
        session.appendMessage(MessageRole.USER, "I want to talk to a person", IntentLabel.HUMAN_REQUEST, T0);
        session.appendMessage(MessageRole.ASSISTANT, "What's your name?", IntentLabel.HUMAN_REQUEST, T0);
        session.setMode(SessionMode.ESCALATING);
        session.startEscalation("I want to talk to a person", T0);
        store.save(session);

        ChatSession loaded = store.load(id).orElseThrow();
        loaded.getEscalation().setClientName("Maria");
        loaded.appendMessage(MessageRole.USER, "Maria", null, T0.plusSeconds(5));
        loaded.appendMessage(MessageRole.ASSISTANT, "Thanks, Maria!", null, T0.plusSeconds(5));
        store.save(loaded);

        ChatSession reloaded = store.load(id).orElseThrow();
        assertEquals(SessionMode.ESCALATING, reloaded.getMode());
        assertEquals(1L, reloaded.getVersion());
        assertEquals(4, reloaded.getMessages().size());
        for (int i = 0; i < 4; i++) {
            assertEquals(i + 1, reloaded.getMessages().get(i).getSequenceNo());
            assertNotNull(reloaded.getMessages().get(i).getId());
        }
        assertEquals("Maria", reloaded.getMessages().get(2).getContent());
        assertEquals("Maria", reloaded.getEscalation().getClientName());
        assertEquals(EscalationStatus.COLLECTING, reloaded.getEscalation().getStatus());
    }

    @Test
    public void shouldRejectSaveOfStaleCopy() {
        String id = UUID.randomUUID().toString();
        ChatSession session = ChatSession.open(id, T0);
        session.appendMessage(MessageRole.USER, "hello", IntentLabel.OTHER, T0);
        store.save(session);

        ChatSession first = store.load(id).orElseThrow();
        ChatSession second = store.load(id).orElseThrow();
        first.setMode(SessionMode.CLOSED);
        store.save(first);

        second.setEscalationOffered(true);
        assertThrows(SessionPersistenceException.class, () -> store.save(second));

        ChatSession current = store.load(id).orElseThrow();
        assertEquals(SessionMode.CLOSED, current.getMode());
        assertFalse(current.isEscalationOffered());
    }
}
