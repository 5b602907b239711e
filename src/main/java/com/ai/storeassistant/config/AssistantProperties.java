package com.ai.storeassistant.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "assistant")
@Data
public class AssistantProperties {

    /** Prior messages handed to the classifier, newest last. */
    private int historyWindow = 10;
    private int maxMessageLength = 2000;
    private List<String> exitPhrases = new ArrayList<>(List.of("exit", "quit", "bye", "goodbye", "end chat"));

    private Classifier classifier = new Classifier();
    private Catalog catalog = new Catalog();
    private Knowledge knowledge = new Knowledge();
    private Http http = new Http();

    @Data
    public static class Classifier {
        /** keyword or llm */
        private String mode = "keyword";
        private String apiKey;
        private String model = "gpt-4o-mini";
        private String url = "https://api.openai.com/v1/chat/completions";
    }

    @Data
    public static class Catalog {
        private String baseUrl = "https://fakestoreapi.com";
        private int maxItems = 5;
    }

    @Data
    public static class Knowledge {
        private String resource = "classpath:store.json";
    }

    @Data
    public static class Http {
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(10);
    }
}
