package com.ai.storeassistant.service;

import com.ai.storeassistant.config.AssistantProperties;
import com.ai.storeassistant.conversation.IntentLabel;
import com.ai.storeassistant.conversation.IntentResult;
import com.ai.storeassistant.exception.AdapterUnavailableException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Classifies intents through an OpenAI-compatible chat completion endpoint.
 * The model is asked for a JSON object {"intent": "...", "detected": true|false}.
 */
@Service
@ConditionalOnProperty(prefix = "assistant.classifier", name = "mode", havingValue = "llm")
public class LlmIntentClassifier implements IntentClassifier {

    private static final Logger log = LoggerFactory.getLogger(LlmIntentClassifier.class);

    private static final String ADAPTER = "classifier";

    private static final String SYSTEM_PROMPT = String.join("\n",
            "You label messages sent to an online store assistant.",
            "Answer with a JSON object only: {\"intent\": <label>, \"detected\": <true|false>}.",
            "Labels:",
            "- product_inquiry: products, stock, prices, categories.",
            "- general_question: store hours, location, contact, promotions, payment methods, social media.",
            "- human_request: the visitor wants a person, an operator or staff.",
            "- other: greetings, thanks, small talk.",
            "- undetected: the message cannot be understood; set detected to false.",
            "Use the earlier lines only as context for the last visitor message.");

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper;
    private final AssistantProperties.Classifier settings;

    public LlmIntentClassifier(RestTemplate lookupRestTemplate, ObjectMapper mapper, AssistantProperties properties) {
        this.restTemplate = lookupRestTemplate;
        this.mapper = mapper;
        this.settings = properties.getClassifier();
    }

    @Override
    public IntentResult classify(List<String> recentHistory, String userText) {
        if (StringUtils.isBlank(settings.getApiKey())) {
            throw new AdapterUnavailableException(ADAPTER, "Classifier API key is not set");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(settings.getApiKey());
        headers.setContentType(MediaType.APPLICATION_JSON);

        List<Map<String, String>> messages = new ArrayList<>();
        messages.add(Map.of("role", "system", "content", SYSTEM_PROMPT));
        if (recentHistory != null && !recentHistory.isEmpty()) {
            messages.add(Map.of("role", "user", "content", "Earlier lines:\n" + String.join("\n", recentHistory)));
        }
        messages.add(Map.of("role", "user", "content", userText));

        Map<String, Object> body = new HashMap<>();
        body.put("model", settings.getModel());
        body.put("temperature", 0);
        body.put("response_format", Map.of("type", "json_object"));
        body.put("messages", messages);

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(
                    settings.getUrl(), new HttpEntity<>(body, headers), String.class);
            return parse(response.getBody());
        } catch (RestClientException e) {
            log.warn("Classifier call failed: {}", e.getMessage());
            throw new AdapterUnavailableException(ADAPTER, "Classifier endpoint failed", e);
        }
    }

    IntentResult parse(String responseBody) {
        if (StringUtils.isBlank(responseBody)) {
            throw new AdapterUnavailableException(ADAPTER, "Empty classifier response");
        }
        try {
            JsonNode root = mapper.readTree(responseBody);
            String content = root.path("choices").path(0).path("message").path("content").asText("");
            if (StringUtils.isBlank(content)) {
                throw new AdapterUnavailableException(ADAPTER, "Classifier returned no content");
            }
            JsonNode verdict = mapper.readTree(content);
            IntentLabel label = IntentLabel.fromCode(verdict.path("intent").asText(null));
            boolean detected = verdict.path("detected").asBoolean(label != IntentLabel.UNDETECTED);
            if (!detected) {
                return IntentResult.undetected();
            }
            return IntentResult.of(label);
        } catch (JsonProcessingException e) {
            throw new AdapterUnavailableException(ADAPTER, "Unreadable classifier response", e);
        }
    }
}
