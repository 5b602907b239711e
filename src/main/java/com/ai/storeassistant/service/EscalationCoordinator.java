package com.ai.storeassistant.service;

import com.ai.storeassistant.conversation.SessionMode;
import com.ai.storeassistant.entity.ChatSession;
import com.ai.storeassistant.entity.EscalationRecord;
import com.ai.storeassistant.entity.EscalationStatus;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Collects a name, then an email, and hands the session to a person. Purely reactive:
 * each call consumes one visitor message and never waits or times out.
 */
@Service
public class EscalationCoordinator {

    private static final Logger log = LoggerFactory.getLogger(EscalationCoordinator.class);

    private static final Pattern NAME_LEAD_IN = Pattern.compile(
            "^(my name is|my name's|name is|i am|i'm|im|this is|call me|it's|it is)\\s+",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern EMAIL_SHAPE = Pattern.compile("^[^@\\s]+@[^@\\s]+$");

    private static final Pattern EMAIL_TOKEN = Pattern.compile("[^@\\s]+@[^@\\s]+");

    private final ResponsePhrases phrases;

    public EscalationCoordinator(ResponsePhrases phrases) {
        this.phrases = phrases;
    }

    /**
     * Opens the escalation record for a session that just entered ESCALATING and asks for the name.
     *
     * @param query what the visitor wanted when asking for a person
     */
    public String begin(ChatSession session, String query, Instant now) {
        session.startEscalation(query, now);
        return phrases.askName();
    }

    /**
     * Feeds one message into the name/email slots. Only valid while the session is ESCALATING.
     */
    public String advance(ChatSession session, String userText, Instant now) {
        if (session.getMode() != SessionMode.ESCALATING) {
            throw new IllegalStateException("Session " + session.getSessionId() + " is not escalating");
        }
        EscalationRecord record = session.startEscalation(null, now);

        if (record.getClientName() == null) {
            String name = extractName(userText);
            if (StringUtils.isBlank(name)) {
                return phrases.askNameAgain();
            }
            record.setClientName(name);
            log.info("[{}] Escalation name captured", session.getSessionId());
            return phrases.askEmail(name);
        }

        String email = extractEmail(userText);
        if (email == null) {
            log.debug("[{}] Rejected email candidate", session.getSessionId());
            return phrases.invalidEmail();
        }
        record.setClientEmail(email);
        return handOff(session, record, now);
    }

    private String handOff(ChatSession session, EscalationRecord record, Instant now) {
        String inquiryId = "INQ-" + now.getEpochSecond();
        record.setInquiryId(inquiryId);
        record.setStatus(EscalationStatus.HANDED_OFF);
        record.setHandedOffAt(now);

        session.setClientName(record.getClientName());
        session.setClientEmail(record.getClientEmail());
        log.info("[{}] mode {} -> {}", session.getSessionId(), session.getMode(), SessionMode.HUMAN_HANDOFF);
        session.setMode(SessionMode.HUMAN_HANDOFF);

        log.info("NEW INQUIRY REGISTERED | id={} session={} name={} email={}",
                inquiryId, session.getSessionId(), record.getClientName(), record.getClientEmail());
        return phrases.handoffConfirmed(record.getClientName(), inquiryId, record.getClientEmail(), session.getSessionId());
    }

    static String extractName(String userText) {
        String name = StringUtils.trimToEmpty(userText);
        Matcher leadIn = NAME_LEAD_IN.matcher(name);
        if (leadIn.find() && name.length() > leadIn.end()) {
            name = name.substring(leadIn.end()).trim();
        }
        name = StringUtils.stripEnd(name, ".!,");
        return StringUtils.trimToNull(name);
    }

    /** Returns the email-shaped part of the text, or null when there is none. */
    static String extractEmail(String userText) {
        String text = StringUtils.trimToEmpty(userText);
        String candidate = null;
        if (EMAIL_SHAPE.matcher(text).matches()) {
            candidate = text;
        } else {
            Matcher token = EMAIL_TOKEN.matcher(text);
            if (token.find()) {
                candidate = token.group();
            }
        }
        candidate = StringUtils.stripEnd(candidate, ".,;!");
        return isEmailShaped(candidate) ? candidate : null;
    }

    static boolean isEmailShaped(String candidate) {
        return candidate != null && EMAIL_SHAPE.matcher(candidate).matches();
    }
}
