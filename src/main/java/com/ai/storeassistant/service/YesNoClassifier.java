package com.ai.storeassistant.service;

import com.ai.storeassistant.conversation.YesNoResult;
import org.springframework.stereotype.Service;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reads a reply to a yes/no offer from short exact answers and unambiguous keywords.
 */
@Service
public class YesNoClassifier {

    private static final Set<String> AFFIRMATIVE_EXACT = Set.of(
            "yes", "yeah", "yep", "ya", "yup", "ok", "okay", "sure", "please",
            "yes please", "go ahead", "please do", "do it", "of course", "absolutely", "definitely"
    );

    private static final Set<String> NEGATIVE_EXACT = Set.of(
            "no", "nope", "nah", "no thanks", "no thank you", "not now", "not yet",
            "never mind", "nevermind", "dont", "don't"
    );

    private static final Pattern AFFIRMATIVE_PATTERN = Pattern.compile(
            "\\b(yes|yeah|yep|yup|ok|okay|sure|go ahead|please do|absolutely|definitely)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern NEGATIVE_PATTERN = Pattern.compile(
            "\\b(no|nope|nah|not now|not yet|never mind|nevermind|don't|dont)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[\\s.!?,]+$");

    public YesNoResult classify(String userInput) {
        if (userInput == null || userInput.isBlank()) {
            return YesNoResult.UNKNOWN;
        }
        String normalized = TRAILING_PUNCTUATION.matcher(userInput.trim().toLowerCase()).replaceAll("");

        if (normalized.length() <= 20) {
            if (AFFIRMATIVE_EXACT.contains(normalized)) return YesNoResult.YES;
            if (NEGATIVE_EXACT.contains(normalized)) return YesNoResult.NO;
        }
        // past this length the reply is a new message, not an answer
        if (normalized.length() > 40) {
            return YesNoResult.UNKNOWN;
        }

        boolean yes = AFFIRMATIVE_PATTERN.matcher(normalized).find();
        boolean no = NEGATIVE_PATTERN.matcher(normalized).find();
        if (yes && !no) return YesNoResult.YES;
        if (no && !yes) return YesNoResult.NO;
        return YesNoResult.UNKNOWN;
    }
}
