package com.vidsum.chatbot.service.session;

import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.function.Supplier;

/**
 * Issues the identifier that groups turns of one conversation in logs and metrics. Nothing is
 * stored against it: a caller that loses or replaces it gets exactly the same answers.
 */
@Component
public class SessionCorrelator {

    private final Supplier<String> idGenerator;

    public SessionCorrelator() {
        this(() -> UUID.randomUUID().toString());
    }

    SessionCorrelator(Supplier<String> idGenerator) {
        this.idGenerator = idGenerator;
    }

    public String correlate(String sessionId) {
        if (sessionId != null && !sessionId.isEmpty()) {
            return sessionId;
        }
        return idGenerator.get();
    }
}
