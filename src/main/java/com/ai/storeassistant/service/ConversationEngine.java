package com.ai.storeassistant.service;

import com.ai.storeassistant.config.AssistantProperties;
import com.ai.storeassistant.conversation.IntentLabel;
import com.ai.storeassistant.conversation.IntentResult;
import com.ai.storeassistant.conversation.SessionMode;
import com.ai.storeassistant.conversation.TurnResult;
import com.ai.storeassistant.conversation.YesNoResult;
import com.ai.storeassistant.dto.CatalogResult;
import com.ai.storeassistant.dto.KnowledgeAnswer;
import com.ai.storeassistant.entity.ChatSession;
import com.ai.storeassistant.entity.ConversationMessage;
import com.ai.storeassistant.entity.EscalationRecord;
import com.ai.storeassistant.entity.MessageRole;
import com.ai.storeassistant.exception.AdapterUnavailableException;
import com.ai.storeassistant.exception.ConversationValidationException;
import com.ai.storeassistant.exception.SessionPersistenceException;
import com.ai.storeassistant.exception.TurnAbortedException;
import com.ai.storeassistant.store.SessionStore;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Single entry for a conversation turn. Loads the session, runs one step of the mode
 * state machine, records both sides of the exchange and commits the session before
 * anything is returned. Lookups never decide mode changes; only this class and the
 * {@link EscalationCoordinator} do.
 */
@Service
public class ConversationEngine {

    private static final Logger log = LoggerFactory.getLogger(ConversationEngine.class);

    static final int MAX_SESSION_ID_LENGTH = 64;

    private final SessionStore sessionStore;
    private final IntentClassifier intentClassifier;
    private final CatalogLookup catalogLookup;
    private final KnowledgeLookup knowledgeLookup;
    private final EscalationCoordinator escalationCoordinator;
    private final YesNoClassifier yesNoClassifier;
    private final ResponsePhrases phrases;
    private final SessionLockRegistry sessionLocks;
    private final AssistantProperties properties;
    private final Clock clock;
    private final Set<String> exitPhrases;

    public ConversationEngine(SessionStore sessionStore,
                              IntentClassifier intentClassifier,
                              CatalogLookup catalogLookup,
                              KnowledgeLookup knowledgeLookup,
                              EscalationCoordinator escalationCoordinator,
                              YesNoClassifier yesNoClassifier,
                              ResponsePhrases phrases,
                              SessionLockRegistry sessionLocks,
                              AssistantProperties properties,
                              Clock clock) {
        this.sessionStore = sessionStore;
        this.intentClassifier = intentClassifier;
        this.catalogLookup = catalogLookup;
        this.knowledgeLookup = knowledgeLookup;
        this.escalationCoordinator = escalationCoordinator;
        this.yesNoClassifier = yesNoClassifier;
        this.phrases = phrases;
        this.sessionLocks = sessionLocks;
        this.properties = properties;
        this.clock = clock;
        this.exitPhrases = properties.getExitPhrases().stream()
                .map(ConversationEngine::normalize)
                .filter(StringUtils::isNotEmpty)
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Processes one visitor message.
     *
     * @param sessionId null or blank on first contact; a new id is issued and returned
     * @throws ConversationValidationException for empty or oversized input, before any state is touched
     * @throws SessionPersistenceException     when the turn could not be recorded; no reply is produced
     * @throws TurnAbortedException            when the calling thread was interrupted before the commit
     */
    public TurnResult handleTurn(String sessionId, String userText) {
        validate(sessionId, userText);
        String id = StringUtils.isBlank(sessionId) ? UUID.randomUUID().toString() : sessionId.trim();
        String text = userText.trim();
        return sessionLocks.withLock(id, () -> runTurn(id, text));
    }

    private TurnResult runTurn(String sessionId, String text) {
        Instant receivedAt = Instant.now(clock);
        ChatSession session = sessionStore.load(sessionId).orElseGet(() -> {
            log.info("[{}] New session", sessionId);
            return ChatSession.open(sessionId, receivedAt);
        });
        List<String> history = recentHistory(session);
        String previousUserText = lastUserText(session);
        log.info("[{}] User: {}", sessionId, text);

        Reply reply = step(session, text, history, previousUserText, receivedAt);

        session.appendMessage(MessageRole.USER, text, reply.intent, receivedAt);
        session.appendMessage(MessageRole.ASSISTANT, reply.text, reply.intent, Instant.now(clock));

        if (Thread.currentThread().isInterrupted()) {
            throw new TurnAbortedException(sessionId);
        }
        persist(session);
        log.info("[{}] Assistant: {}", sessionId, reply.text);
        return new TurnResult(sessionId, reply.text, reply.continueConversation, session.getMode());
    }

    private Reply step(ChatSession session, String text, List<String> history, String previousUserText, Instant now) {
        String sessionId = session.getSessionId();
        SessionMode mode = session.getMode();

        if (mode == SessionMode.CLOSED) {
            return Reply.ending(phrases.sessionEnded(sessionId));
        }
        boolean exitRequested = isExitPhrase(text);
        if (mode == SessionMode.HUMAN_HANDOFF) {
            if (exitRequested) {
                return Reply.ending(phrases.goodbye(sessionId));
            }
            EscalationRecord record = session.getEscalation();
            return Reply.of(phrases.handoffInProgress(
                    record != null && record.isHandedOff() ? record.getInquiryId() : "-",
                    session.getClientEmail(), sessionId));
        }
        if (exitRequested) {
            session.setEscalationOffered(false);
            transition(session, SessionMode.CLOSED);
            return Reply.ending(phrases.goodbye(sessionId));
        }

        if (session.isEscalationOffered()) {
            session.setEscalationOffered(false);
            YesNoResult answer = yesNoClassifier.classify(text);
            if (answer == YesNoResult.YES) {
                transition(session, SessionMode.ESCALATING);
                return Reply.of(escalationCoordinator.begin(session, previousUserText, now), IntentLabel.HUMAN_REQUEST);
            }
            if (answer == YesNoResult.NO) {
                return Reply.of(phrases.escalationDeclined());
            }
        }

        if (mode == SessionMode.ESCALATING) {
            return Reply.of(escalationCoordinator.advance(session, text, now));
        }

        IntentResult intent;
        try {
            intent = intentClassifier.classify(history, text);
            if (intent == null) {
                throw new AdapterUnavailableException("classifier", "Classifier returned no result");
            }
        } catch (AdapterUnavailableException e) {
            log.warn("[{}] Classifier unavailable: {}", sessionId, e.getMessage(), e);
            return Reply.of(phrases.temporarilyUnavailable());
        }
        log.debug("[{}] {}", sessionId, intent);

        if (!intent.isDetected()) {
            session.setEscalationOffered(true);
            return Reply.of(phrases.notUnderstoodOfferHuman(), IntentLabel.UNDETECTED);
        }
        IntentLabel label = intent.getLabel();
        if (session.getInitialIntent() == null) {
            session.setInitialIntent(label);
        }

        switch (label) {
            case HUMAN_REQUEST:
                transition(session, SessionMode.ESCALATING);
                return Reply.of(escalationCoordinator.begin(session, text, now), label);
            case PRODUCT_INQUIRY:
                return Reply.of(answerProductInquiry(session, text), label);
            case GENERAL_QUESTION:
                return Reply.of(answerGeneralQuestion(sessionId, text), label);
            case OTHER:
            default:
                return Reply.of(phrases.offerMoreHelp(), label);
        }
    }

    private String answerProductInquiry(ChatSession session, String text) {
        SessionMode before = session.getMode();
        transition(session, SessionMode.INQUIRY);
        try {
            CatalogResult result = catalogLookup.search(text);
            if (result == null) {
                throw new AdapterUnavailableException("catalog", "Catalog returned no result");
            }
            return phrases.catalogReply(result);
        } catch (AdapterUnavailableException e) {
            log.warn("[{}] Catalog unavailable: {}", session.getSessionId(), e.getMessage(), e);
            return phrases.temporarilyUnavailable();
        } finally {
            // an inquiry never outlives its turn
            transition(session, before);
        }
    }

    private String answerGeneralQuestion(String sessionId, String text) {
        try {
            KnowledgeAnswer answer = knowledgeLookup.lookup(text);
            if (answer == null) {
                throw new AdapterUnavailableException("knowledge", "Store knowledge returned no result");
            }
            return answer.isFound() ? answer.getAnswerText() : phrases.knowledgeFallback();
        } catch (AdapterUnavailableException e) {
            log.warn("[{}] Store knowledge unavailable: {}", sessionId, e.getMessage(), e);
            return phrases.temporarilyUnavailable();
        }
    }

    private void persist(ChatSession session) {
        try {
            sessionStore.save(session);
        } catch (SessionPersistenceException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("[{}] Session commit failed", session.getSessionId(), e);
            throw new SessionPersistenceException(session.getSessionId(), "Could not save session", e);
        }
    }

    private void transition(ChatSession session, SessionMode target) {
        SessionMode current = session.getMode();
        if (current == target) return;
        log.info("[{}] mode {} -> {}", session.getSessionId(), current, target);
        session.setMode(target);
    }

    private List<String> recentHistory(ChatSession session) {
        List<ConversationMessage> messages = session.getMessages();
        int window = Math.max(0, properties.getHistoryWindow());
        int start = Math.max(0, messages.size() - window);
        List<String> history = new ArrayList<>(messages.size() - start);
        for (int i = start; i < messages.size(); i++) {
            ConversationMessage m = messages.get(i);
            history.add(m.getRole().name().toLowerCase(Locale.ROOT) + ": " + m.getContent());
        }
        return history;
    }

    private String lastUserText(ChatSession session) {
        List<ConversationMessage> messages = session.getMessages();
        for (int i = messages.size() - 1; i >= 0; i--) {
            if (messages.get(i).getRole() == MessageRole.USER) {
                return messages.get(i).getContent();
            }
        }
        return null;
    }

    private boolean isExitPhrase(String text) {
        return exitPhrases.contains(normalize(text));
    }

    private void validate(String sessionId, String userText) {
        if (StringUtils.isBlank(userText)) {
            throw new ConversationValidationException("Message must not be empty");
        }
        if (userText.trim().length() > properties.getMaxMessageLength()) {
            throw new ConversationValidationException(
                    "Message must not be longer than " + properties.getMaxMessageLength() + " characters");
        }
        if (sessionId != null && sessionId.trim().length() > MAX_SESSION_ID_LENGTH) {
            throw new ConversationValidationException("Session id is too long");
        }
    }

    private static String normalize(String text) {
        return StringUtils.stripEnd(StringUtils.trimToEmpty(text).toLowerCase(Locale.ROOT), ".!?").trim();
    }

    private static final class Reply {
        private final String text;
        private final IntentLabel intent;
        private final boolean continueConversation;

        private Reply(String text, IntentLabel intent, boolean continueConversation) {
            this.text = text;
            this.intent = intent;
            this.continueConversation = continueConversation;
        }

        static Reply of(String text) {
            return new Reply(text, null, true);
        }

        static Reply of(String text, IntentLabel intent) {
            return new Reply(text, intent, true);
        }

        static Reply ending(String text) {
            return new Reply(text, null, false);
        }
    }
}
