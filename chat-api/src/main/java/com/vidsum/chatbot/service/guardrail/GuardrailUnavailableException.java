package com.vidsum.chatbot.service.guardrail;

public class GuardrailUnavailableException extends RuntimeException {

    private final GuardrailDirection direction;

    public GuardrailUnavailableException(GuardrailDirection direction, String message, Throwable cause) {
        super(message, cause);
        this.direction = direction;
    }

    public GuardrailDirection direction() {
        return direction;
    }
}
