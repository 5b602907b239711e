package com.ai.storeassistant.service;

import com.ai.storeassistant.conversation.IntentLabel;
import com.ai.storeassistant.conversation.IntentResult;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Rule-based classifier used when no model endpoint is configured. A request for a person
 * wins over everything else; product words win over store-info words.
 */
@Service
@ConditionalOnProperty(prefix = "assistant.classifier", name = "mode", havingValue = "keyword", matchIfMissing = true)
public class KeywordIntentClassifier implements IntentClassifier {

    private static final Pattern HUMAN_REQUEST = Pattern.compile(
            "\\b(human|real person|operator|agent|representative|staff member|employee|manager|customer service|(talk|speak|chat) (to|with) (a |an |some)?(one|body|person))\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern PRODUCT_INQUIRY = Pattern.compile(
            "\\b(products?|items?|stock|in stock|price|prices|cost|costs|how much|buy|sell|selling|catalog|categor(y|ies)|backpacks?|bags?|shirts?|t-shirts?|jackets?|shoes|jewel(le)?ry|rings?|electronics|laptops?|monitors?|drives?|clothing|clothes)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern AVAILABILITY = Pattern.compile(
            "\\b(do you (have|sell|carry)|have you got|is there any|are there any)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern GENERAL_QUESTION = Pattern.compile(
            "\\b(hours?|open|opening|close|closing|when|where|address|location|located|directions|contact|phone|email|website|promotions?|discounts?|sales?|offers?|deals?|payment|pay|cards?|cash|paypal|social|instagram|facebook|tiktok|about (the|your) store|store info)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern OTHER = Pattern.compile(
            "\\b(hi|hello|hey|good (morning|afternoon|evening)|thanks|thank you|how are you|nice|great|cool)\\b",
            Pattern.CASE_INSENSITIVE
    );

    @Override
    public IntentResult classify(List<String> recentHistory, String userText) {
        if (userText == null || userText.isBlank()) return IntentResult.undetected();
        String t = userText.trim();

        if (HUMAN_REQUEST.matcher(t).find()) {
            return IntentResult.of(IntentLabel.HUMAN_REQUEST);
        }
        if (PRODUCT_INQUIRY.matcher(t).find() || AVAILABILITY.matcher(t).find()) {
            return IntentResult.of(IntentLabel.PRODUCT_INQUIRY);
        }
        if (GENERAL_QUESTION.matcher(t).find()) {
            return IntentResult.of(IntentLabel.GENERAL_QUESTION);
        }
        if (OTHER.matcher(t).find()) {
            return IntentResult.of(IntentLabel.OTHER);
        }
        return IntentResult.undetected();
    }
}
