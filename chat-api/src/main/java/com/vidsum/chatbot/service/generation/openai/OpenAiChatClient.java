package com.vidsum.chatbot.service.generation.openai;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Minimal client for an OpenAI compatible {@code /v1/chat/completions} endpoint in streaming mode.
 */
@Component
public class OpenAiChatClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiChatClient.class);

    private final WebClient webClient;
    private final Duration timeout;

    public OpenAiChatClient(@Qualifier("llmWebClient") WebClient webClient,
                            @Value("${chat.llm.timeout-seconds:60}") long timeoutSeconds) {
        this.webClient = webClient;
        this.timeout = Duration.ofSeconds(Math.max(1, timeoutSeconds));
    }

    /**
     * Streams raw completion chunks. The timeout applies to the gap between two chunks, not to the
     * whole answer.
     */
    public Flux<StreamEvent> stream(Request request) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("model", request.model());
        payload.put("messages", request.messages());
        payload.put("stream", Boolean.TRUE);
        if (request.temperature() != null) {
            payload.put("temperature", request.temperature());
        }
        if (request.maxTokens() != null) {
            payload.put("max_tokens", request.maxTokens());
        }

        return webClient.post()
                .uri("/v1/chat/completions")
                .accept(MediaType.TEXT_EVENT_STREAM)
                .bodyValue(payload)
                .retrieve()
                .bodyToFlux(new ParameterizedTypeReference<ServerSentEvent<String>>() {
                })
                .timeout(timeout)
                .map(ServerSentEvent::data)
                .filter(data -> data != null && !data.isBlank())
                .map(data -> {
                    String trimmed = data.trim();
                    return StreamEvent.DONE_MARKER.equals(trimmed) ? StreamEvent.DONE : new StreamEvent(trimmed, false);
                })
                .onErrorMap(WebClientResponseException.class, this::logAndWrap)
                .onErrorMap(ex -> !(ex instanceof OpenAiChatException),
                        ex -> new OpenAiChatException("Failed to stream chat completion: " + ex.getMessage(), ex));
    }

    private OpenAiChatException logAndWrap(WebClientResponseException exception) {
        HttpStatusCode status = exception.getStatusCode();
        log.warn("LLM chat completion returned {}: {}", status, exception.getResponseBodyAsString());
        return new OpenAiChatException("Chat completion returned " + status.value(), exception);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Request(String model,
                          List<Message> messages,
                          Double temperature,
                          Integer maxTokens) {
    }

    public record Message(String role, String content) {
    }

    public record StreamEvent(String data, boolean done) {

        static final String DONE_MARKER = "[DONE]";
        public static final StreamEvent DONE = new StreamEvent(DONE_MARKER, true);
    }
}
