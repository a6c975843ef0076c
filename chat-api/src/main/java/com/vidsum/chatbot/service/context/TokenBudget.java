package com.vidsum.chatbot.service.context;

/**
 * Rough token accounting for the generation service's input limit.
 */
public class TokenBudget {

    private final int maxTokens;

    public TokenBudget(int maxTokens) {
        this.maxTokens = maxTokens;
    }

    public int maxTokens() {
        return maxTokens;
    }

    public boolean fits(int tokens) {
        return tokens <= maxTokens;
    }

    public static int estimate(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return Math.max(1, text.length() / 4 + 16);
    }
}
