package com.ai.storeassistant.dto;

public final class KnowledgeAnswer {

    private final boolean found;
    private final String topic;
    private final String answerText;

    private KnowledgeAnswer(boolean found, String topic, String answerText) {
        this.found = found;
        this.topic = topic;
        this.answerText = answerText;
    }

    public static KnowledgeAnswer of(String topic, String answerText) {
        return new KnowledgeAnswer(true, topic, answerText);
    }

    public static KnowledgeAnswer notFound() {
        return new KnowledgeAnswer(false, null, null);
    }

    public boolean isFound() {
        return found;
    }

    public String getTopic() {
        return topic;
    }

    public String getAnswerText() {
        return answerText;
    }
}
