package com.ai.storeassistant.service;

import com.ai.storeassistant.dto.CatalogItem;
import com.ai.storeassistant.dto.CatalogResult;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Every sentence the assistant says. Flow code decides what to say, this class decides how.
 */
@Component
public class ResponsePhrases {

    public String notUnderstoodOfferHuman() {
        return "Sorry, I didn't quite get that. Would you like me to connect you with a member of our team?";
    }

    public String offerMoreHelp() {
        return "Happy to help! You can ask me about our products, prices and stock, or about store hours, "
                + "location, contact details and promotions. What would you like to know?";
    }

    public String escalationDeclined() {
        return "No problem. Is there anything else I can help you with?";
    }

    public String askName() {
        return "Sure, I'll put you in touch with our team. First, what's your name?";
    }

    public String askNameAgain() {
        return "Sorry, I didn't catch your name. Could you tell me your name?";
    }

    public String askEmail(String name) {
        return "Thanks, " + name + "! What's the best email address to reach you?";
    }

    public String invalidEmail() {
        return "Hmm, that doesn't look like an email address. Could you type it again, like name@example.com?";
    }

    public String handoffConfirmed(String name, String inquiryId, String email, String sessionId) {
        return "Thank you, " + name + "! Your inquiry has been registered (ID: " + inquiryId + "). "
                + "A member of our team will contact you at " + email + " within 24-48 hours. "
                + "Your session reference is " + sessionId + ".";
    }

    public String handoffInProgress(String inquiryId, String email, String sessionId) {
        return "Your conversation has been passed to our team (inquiry " + inquiryId + "). "
                + "They will contact you at " + email + ". Your session reference is " + sessionId + ".";
    }

    public String catalogReply(CatalogResult result) {
        if (!result.isFound()) {
            return "Sorry, I couldn't find any products matching that. Is there something else you're looking for?";
        }
        if (result.isCategoryListing()) {
            return "We carry these categories: " + String.join(", ", result.getCategories())
                    + ". Which one would you like to browse?";
        }
        StringBuilder reply = new StringBuilder("Here's what I found:");
        List<CatalogItem> items = result.getItems();
        for (CatalogItem item : items) {
            reply.append("\n- ").append(item.getName());
            if (item.getPrice() != null) {
                reply.append(": $").append(formatPrice(item.getPrice()));
            }
            if (item.getStock() != null) {
                reply.append(item.getStock() > 0 ? ", " + item.getStock() + " in stock" : ", currently out of stock");
            }
        }
        if (result.isFollowUp()) {
            reply.append("\nWhich category or product are you interested in?");
        }
        return reply.toString();
    }

    public String knowledgeFallback() {
        return "I don't have that information at hand. Please contact the store directly and we'll be glad to help.";
    }

    public String temporarilyUnavailable() {
        return "Sorry, I can't look that up right now. Please try again in a moment.";
    }

    public String goodbye(String sessionId) {
        return "Thanks for chatting with us. Goodbye! Your session reference is " + sessionId + ".";
    }

    public String sessionEnded(String sessionId) {
        return "This conversation has ended (reference " + sessionId + "). Please start a new chat if you need anything else.";
    }

    static String formatPrice(BigDecimal price) {
        return price.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}
