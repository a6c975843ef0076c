package com.vidsum.chatbot.service.guardrail;

import reactor.core.publisher.Mono;

public interface GuardrailGate {

    /**
     * Classifies complete text against the moderation policy. A blocked decision carries the
     * fixed wording to show in place of (input) or after (output) the text.
     */
    Mono<GuardrailDecision> evaluate(String text, GuardrailDirection direction);

    boolean configured();
}
