package com.vidsum.chatbot.service.guardrail;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Calls the moderation service's apply endpoint for one piece of text. The service answers with
 * {@code GUARDRAIL_INTERVENED} and its pre-approved replacement wording when the text violates the
 * topic or safety policy.
 */
@Component
@ConditionalOnProperty(name = "chat.guardrail.enabled", havingValue = "true", matchIfMissing = true)
public class ModerationServiceGuardrailGate implements GuardrailGate {

    private static final Logger log = LoggerFactory.getLogger(ModerationServiceGuardrailGate.class);
    static final String INTERVENED = "GUARDRAIL_INTERVENED";

    private final WebClient guardrailWebClient;
    private final String guardrailId;
    private final String guardrailVersion;
    private final String blockedInputMessage;
    private final String blockedOutputMessage;
    private final Duration timeout;

    public ModerationServiceGuardrailGate(@Qualifier("guardrailWebClient") WebClient guardrailWebClient,
                                          @Value("${chat.guardrail.id:}") String guardrailId,
                                          @Value("${chat.guardrail.version:}") String guardrailVersion,
                                          @Value("${chat.guardrail.blocked-input-message:Sorry, I can only answer questions about the analyzed video summaries.}") String blockedInputMessage,
                                          @Value("${chat.guardrail.blocked-output-message:This response was withheld because it did not meet the content policy.}") String blockedOutputMessage,
                                          @Value("${chat.guardrail.timeout-seconds:10}") long timeoutSeconds) {
        this.guardrailWebClient = guardrailWebClient;
        this.guardrailId = guardrailId;
        this.guardrailVersion = guardrailVersion;
        this.blockedInputMessage = blockedInputMessage;
        this.blockedOutputMessage = blockedOutputMessage;
        this.timeout = Duration.ofSeconds(Math.max(1, timeoutSeconds));
    }

    @Override
    public boolean configured() {
        return guardrailId != null && !guardrailId.isBlank()
                && guardrailVersion != null && !guardrailVersion.isBlank();
    }

    @Override
    public Mono<GuardrailDecision> evaluate(String text, GuardrailDirection direction) {
        if (!configured()) {
            log.debug("Guardrail not configured, allowing {} text", direction);
            return Mono.just(GuardrailDecision.allowed());
        }
        if (text == null || text.isBlank()) {
            return Mono.just(GuardrailDecision.allowed());
        }
        ApplyRequest payload = new ApplyRequest(direction.name(), List.of(new ContentBlock(new TextBlock(text))));
        return guardrailWebClient.post()
                .uri("/guardrail/{id}/version/{version}/apply", guardrailId, guardrailVersion)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(payload)
                .retrieve()
                .bodyToMono(ApplyResponse.class)
                .timeout(timeout)
                .map(response -> toDecision(response, direction))
                .switchIfEmpty(Mono.error(() -> new GuardrailUnavailableException(direction,
                        "Moderation service returned an empty body", null)))
                .onErrorMap(ex -> !(ex instanceof GuardrailUnavailableException), ex -> wrap(ex, direction));
    }

    private GuardrailDecision toDecision(ApplyResponse response, GuardrailDirection direction) {
        if (!INTERVENED.equals(response.action())) {
            return GuardrailDecision.allowed();
        }
        String replacement = response.firstOutputText();
        if (replacement == null || replacement.isBlank()) {
            replacement = direction == GuardrailDirection.INPUT ? blockedInputMessage : blockedOutputMessage;
        }
        log.debug("Moderation service intervened on {} text", direction);
        return GuardrailDecision.blocked(replacement);
    }

    private GuardrailUnavailableException wrap(Throwable ex, GuardrailDirection direction) {
        if (ex instanceof WebClientResponseException responseException) {
            log.warn("Moderation service returned {} for {} check", responseException.getStatusCode(), direction);
            return new GuardrailUnavailableException(direction,
                    "Moderation service returned " + responseException.getStatusCode().value(), ex);
        }
        log.warn("Moderation service call failed for {} check: {}", direction, ex.getMessage());
        return new GuardrailUnavailableException(direction, "Moderation service unavailable", ex);
    }

    private record ApplyRequest(String source, List<ContentBlock> content) {
    }

    private record ContentBlock(TextBlock text) {
    }

    private record TextBlock(String text) {
    }

    private record ApplyResponse(String action, List<Output> outputs) {
        String firstOutputText() {
            return outputs == null || outputs.isEmpty() ? null : outputs.get(0).text();
        }
    }

    private record Output(String text) {
    }
}
