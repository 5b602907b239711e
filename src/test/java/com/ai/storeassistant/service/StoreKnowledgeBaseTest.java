package com.ai.storeassistant.service;

import com.ai.storeassistant.config.AssistantProperties;
import com.ai.storeassistant.dto.KnowledgeAnswer;
import com.ai.storeassistant.exception.AdapterUnavailableException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class StoreKnowledgeBaseTest {

    private StoreKnowledgeBase knowledgeBase(String resource, String today) {
        AssistantProperties properties = new AssistantProperties();
        properties.getKnowledge().setResource(resource);
        Clock clock = Clock.fixed(Instant.parse(today + "T12:00:00Z"), ZoneOffset.UTC);
        return new StoreKnowledgeBase(new DefaultResourceLoader(), new ObjectMapper(), clock, properties);
    }

    @Test
    public void shouldAnswerKnownTopics() {
        StoreKnowledgeBase kb = knowledgeBase("classpath:store.json", "2026-03-01");

        KnowledgeAnswer hours = kb.lookup("What are your hours?");
        assertTrue(hours.isFound());
        assertEquals(StoreKnowledgeBase.HOURS, hours.getTopic());
        assertTrue(hours.getAnswerText().contains("9:00 - 20:00"));

        assertTrue(kb.lookup("Where are you located?").getAnswerText().contains("123 Main Street"));
        assertTrue(kb.lookup("What's your phone number?").getAnswerText().contains("+1 555 010 2030"));
        assertEquals("We accept Cash, Credit card, Debit card, PayPal.",
                kb.lookup("Do you take PayPal?").getAnswerText());
        assertTrue(kb.lookup("Are you on instagram?").getAnswerText().contains("https://instagram.com/urbancorner"));
    }

    @Test
    public void shouldListOnlyActivePromotions() {
        String answer = knowledgeBase("classpath:store.json", "2026-03-01").lookup("Any promotions?").getAnswerText();

        assertTrue(answer.contains("10% off all backpacks"));
        assertFalse(answer.contains("Spring jewelry sale"));

        String later = knowledgeBase("classpath:store.json", "2100-01-01").lookup("any discounts").getAnswerText();
        assertEquals("We don't have any promotions running right now.", later);
    }

    @Test
    public void shouldAnswerPromotionQuestionAskedWithWhen() {
        String answer = knowledgeBase("classpath:store.json", "2026-03-01").lookup("When does the sale end?").getAnswerText();

        assertTrue(answer.startsWith("Current promotions:"));
        assertTrue(answer.contains("until 2099-12-31"));
    }

    @Test
    public void shouldReportUnknownTopicAsNotFound() {
        KnowledgeAnswer answer = knowledgeBase("classpath:store.json", "2026-03-01").lookup("Is it going to rain?");

        assertFalse(answer.isFound());
        assertNull(answer.getAnswerText());
    }

    @Test
    public void shouldFailAsUnavailableWhenDataFileIsMissing() {
        StoreKnowledgeBase kb = knowledgeBase("classpath:does-not-exist.json", "2026-03-01");

        AdapterUnavailableException e = assertThrows(AdapterUnavailableException.class, () -> kb.lookup("hours?"));
        assertEquals("knowledge", e.getAdapter());
    }

    @Test
    public void shouldPickFirstMatchingTopic() {
        assertEquals(StoreKnowledgeBase.HOURS, StoreKnowledgeBase.detectTopic("When do you open on Sunday?"));
        assertEquals(StoreKnowledgeBase.LOCATION, StoreKnowledgeBase.detectTopic("what's the address"));
        assertEquals(StoreKnowledgeBase.PROMOTIONS, StoreKnowledgeBase.detectTopic("When does the sale end?"));
        assertNull(StoreKnowledgeBase.detectTopic("   "));
    }
}
