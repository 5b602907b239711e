package com.ai.storeassistant.service;

import com.ai.storeassistant.config.AssistantProperties;
import com.ai.storeassistant.dto.KnowledgeAnswer;
import com.ai.storeassistant.exception.AdapterUnavailableException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Store facts read from a local JSON document. Topics are picked by keywords in the
 * question; the first matching topic in declaration order answers.
 */
@Service
public class StoreKnowledgeBase implements KnowledgeLookup {

    private static final Logger log = LoggerFactory.getLogger(StoreKnowledgeBase.class);

    private static final String ADAPTER = "knowledge";

    static final String HOURS = "hours";
    static final String LOCATION = "location";
    static final String CONTACT = "contact";
    static final String PROMOTIONS = "promotions";
    static final String PAYMENT_METHODS = "payment_methods";
    static final String SOCIAL_MEDIA = "social_media";
    static final String STORE_INFO = "store_info";

    private static final Map<String, Pattern> TOPICS = new LinkedHashMap<>();

    static {
        TOPICS.put(PROMOTIONS, Pattern.compile(
                "\\b(promotions?|promos?|discounts?|sales?|offers?|deals?|coupons?)\\b", Pattern.CASE_INSENSITIVE));
        TOPICS.put(HOURS, Pattern.compile(
                "\\b(hours?|open|opening|close|closing|closed|weekends?|sunday|saturday)\\b", Pattern.CASE_INSENSITIVE));
        TOPICS.put(LOCATION, Pattern.compile(
                "\\b(where|address|location|located|directions|find you|city|country)\\b", Pattern.CASE_INSENSITIVE));
        TOPICS.put(PAYMENT_METHODS, Pattern.compile(
                "\\b(pay|payment|payments|cards?|cash|paypal|credit|debit)\\b", Pattern.CASE_INSENSITIVE));
        TOPICS.put(SOCIAL_MEDIA, Pattern.compile(
                "\\b(social|instagram|facebook|tiktok|follow)\\b", Pattern.CASE_INSENSITIVE));
        TOPICS.put(CONTACT, Pattern.compile(
                "\\b(contact|phone|call|email|e-mail|website|reach)\\b", Pattern.CASE_INSENSITIVE));
        TOPICS.put(STORE_INFO, Pattern.compile(
                "\\b(about (the|your) store|store info|who are you|what is this store|what do you do)\\b", Pattern.CASE_INSENSITIVE));
    }

    private final ResourceLoader resourceLoader;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final String resourceLocation;

    private volatile JsonNode store;

    public StoreKnowledgeBase(ResourceLoader resourceLoader, ObjectMapper mapper, Clock clock,
                              AssistantProperties properties) {
        this.resourceLoader = resourceLoader;
        this.mapper = mapper;
        this.clock = clock;
        this.resourceLocation = properties.getKnowledge().getResource();
    }

    @Override
    public KnowledgeAnswer lookup(String query) {
        JsonNode data = storeData();
        String topic = detectTopic(query);
        if (topic == null) {
            return KnowledgeAnswer.notFound();
        }
        String answer = answer(topic, data);
        if (StringUtils.isBlank(answer)) {
            log.debug("No data for topic {}", topic);
            return KnowledgeAnswer.notFound();
        }
        return KnowledgeAnswer.of(topic, answer);
    }

    static String detectTopic(String query) {
        if (StringUtils.isBlank(query)) return null;
        for (Map.Entry<String, Pattern> entry : TOPICS.entrySet()) {
            if (entry.getValue().matcher(query).find()) {
                return entry.getKey();
            }
        }
        return null;
    }

    private String answer(String topic, JsonNode data) {
        switch (topic) {
            case HOURS:
                return hours(data.path("hours"));
            case LOCATION:
                return location(data.path("location"));
            case CONTACT:
                return contact(data.path("contact"));
            case PROMOTIONS:
                return promotions(data.path("promotions"));
            case PAYMENT_METHODS:
                return paymentMethods(data.path("payment_methods"));
            case SOCIAL_MEDIA:
                return socialMedia(data.path("social_media"));
            case STORE_INFO:
                return storeInfo(data);
            default:
                return null;
        }
    }

    private String hours(JsonNode hours) {
        if (hours.isMissingNode() || hours.isEmpty()) return null;
        return "Our opening hours are: Monday to Friday " + hours.path("monday_to_friday").asText("-")
                + ", Saturday " + hours.path("saturday").asText("-")
                + ", Sunday " + hours.path("sunday").asText("-") + ".";
    }

    private String location(JsonNode location) {
        if (location.isMissingNode() || location.isEmpty()) return null;
        return "You can find us at " + location.path("address").asText("")
                + ", " + location.path("city").asText("")
                + ", " + location.path("country").asText("") + ".";
    }

    private String contact(JsonNode contact) {
        if (contact.isMissingNode() || contact.isEmpty()) return null;
        return "You can reach us by phone at " + contact.path("phone").asText("-")
                + ", by email at " + contact.path("email").asText("-")
                + ", or through our website " + contact.path("website").asText("-") + ".";
    }

    private String promotions(JsonNode promotions) {
        if (!promotions.isArray()) return null;
        LocalDate today = LocalDate.now(clock);
        List<String> active = new ArrayList<>();
        for (JsonNode promo : promotions) {
            String validUntil = promo.path("valid_until").asText("");
            try {
                if (!LocalDate.parse(validUntil).isBefore(today)) {
                    active.add(promo.path("title").asText() + " (until " + validUntil + ")");
                }
            } catch (DateTimeParseException e) {
                log.warn("Skipping promotion with bad date '{}'", validUntil);
            }
        }
        if (active.isEmpty()) {
            return "We don't have any promotions running right now.";
        }
        return "Current promotions: " + String.join("; ", active) + ".";
    }

    private String paymentMethods(JsonNode methods) {
        if (!methods.isArray() || methods.isEmpty()) return null;
        List<String> names = new ArrayList<>();
        methods.forEach(m -> names.add(m.asText()));
        return "We accept " + String.join(", ", names) + ".";
    }

    private String socialMedia(JsonNode social) {
        if (social.isMissingNode() || social.isEmpty()) return null;
        List<String> links = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = social.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (StringUtils.isNotBlank(field.getValue().asText())) {
                links.add(StringUtils.capitalize(field.getKey()) + ": " + field.getValue().asText());
            }
        }
        return links.isEmpty() ? null : "Follow us on " + String.join(", ", links) + ".";
    }

    private String storeInfo(JsonNode data) {
        String name = data.path("name").asText("");
        if (StringUtils.isBlank(name)) return null;
        String summary = data.path("summary").asText("");
        return StringUtils.isBlank(summary) ? "This is " + name + "." : "This is " + name + ". " + summary;
    }

    private JsonNode storeData() {
        JsonNode loaded = store;
        if (loaded != null) {
            return loaded;
        }
        synchronized (this) {
            if (store == null) {
                store = read();
            }
            return store;
        }
    }

    private JsonNode read() {
        Resource resource = resourceLoader.getResource(resourceLocation);
        if (!resource.exists()) {
            throw new AdapterUnavailableException(ADAPTER, "Store data file not found: " + resourceLocation);
        }
        try (InputStream in = resource.getInputStream()) {
            JsonNode data = mapper.readTree(in).path("store");
            if (data.isMissingNode()) {
                throw new AdapterUnavailableException(ADAPTER, "Store data file has no 'store' object");
            }
            log.info("Loaded store knowledge from {} ({} topics)", resourceLocation, data.size());
            return data;
        } catch (IOException e) {
            throw new AdapterUnavailableException(ADAPTER, "Invalid store data file: " + e.getMessage(), e);
        }
    }
}
