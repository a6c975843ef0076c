package com.vidsum.chatbot.service.guardrail;

public enum GuardrailDirection {
    INPUT,
    OUTPUT
}
