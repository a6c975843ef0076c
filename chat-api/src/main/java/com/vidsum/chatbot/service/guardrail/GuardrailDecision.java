package com.vidsum.chatbot.service.guardrail;

import java.util.Objects;

public record GuardrailDecision(boolean blocked, String message) {

    private static final GuardrailDecision ALLOWED = new GuardrailDecision(false, null);

    public static GuardrailDecision allowed() {
        return ALLOWED;
    }

    public static GuardrailDecision blocked(String message) {
        Objects.requireNonNull(message, "message");
        return new GuardrailDecision(true, message);
    }
}
