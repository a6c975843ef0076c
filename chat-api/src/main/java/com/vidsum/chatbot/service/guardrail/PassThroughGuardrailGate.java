package com.vidsum.chatbot.service.guardrail;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

@Component
@ConditionalOnProperty(name = "chat.guardrail.enabled", havingValue = "false")
public class PassThroughGuardrailGate implements GuardrailGate {

    @Override
    public Mono<GuardrailDecision> evaluate(String text, GuardrailDirection direction) {
        return Mono.just(GuardrailDecision.allowed());
    }

    @Override
    public boolean configured() {
        return false;
    }
}
