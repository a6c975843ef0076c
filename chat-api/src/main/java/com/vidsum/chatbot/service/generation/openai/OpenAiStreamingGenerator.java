package com.vidsum.chatbot.service.generation.openai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidsum.chatbot.model.ChatMessageRole;
import com.vidsum.chatbot.model.ChatTurn;
import com.vidsum.chatbot.service.context.AssembledPrompt;
import com.vidsum.chatbot.service.generation.GenerationFailedException;
import com.vidsum.chatbot.service.generation.StreamingGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

@Component
@Profile("!template")
public class OpenAiStreamingGenerator implements StreamingGenerator {

    private static final Logger log = LoggerFactory.getLogger(OpenAiStreamingGenerator.class);

    private final OpenAiChatClient chatClient;
    private final ObjectMapper objectMapper;
    private final String model;
    private final double temperature;
    private final Integer maxOutputTokens;

    public OpenAiStreamingGenerator(OpenAiChatClient chatClient,
                                    ObjectMapper objectMapper,
                                    @Value("${chat.llm.model:gpt-4o-mini}") String model,
                                    @Value("${chat.llm.temperature:0.3}") double temperature,
                                    @Value("${chat.llm.max-output-tokens:2048}") int maxOutputTokens) {
        this.chatClient = chatClient;
        this.objectMapper = objectMapper;
        this.model = Objects.requireNonNullElse(model, "gpt-4o-mini");
        this.temperature = temperature;
        this.maxOutputTokens = maxOutputTokens > 0 ? maxOutputTokens : null;
    }

    @Override
    public Flux<String> generate(AssembledPrompt prompt) {
        return Flux.defer(() -> chatClient.stream(new OpenAiChatClient.Request(model, buildMessages(prompt), temperature, maxOutputTokens)))
                .takeUntil(OpenAiChatClient.StreamEvent::done)
                .filter(event -> !event.done())
                .concatMap(event -> Flux.fromIterable(deltas(event.data())))
                .onErrorMap(ex -> !(ex instanceof GenerationFailedException), this::toGenerationFailure);
    }

    private List<String> deltas(String data) {
        try {
            StreamResponse response = objectMapper.readValue(data, StreamResponse.class);
            if (response.error() != null) {
                throw new GenerationFailedException(response.error().describe());
            }
            StreamChoice choice = response.firstChoice();
            if (choice == null || choice.delta() == null) {
                return List.of();
            }
            String content = choice.delta().content();
            if (choice.finishReason() != null && !"stop".equals(choice.finishReason())) {
                log.debug("Generation finished with reason {}", choice.finishReason());
            }
            return content == null || content.isEmpty() ? List.of() : List.of(content);
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse streaming chunk: {}", e.getOriginalMessage());
            return List.of();
        }
    }

    private GenerationFailedException toGenerationFailure(Throwable ex) {
        log.error("Generation stream failed: {}", ex.getMessage());
        return new GenerationFailedException(ex.getMessage() == null ? "Generation service failed" : ex.getMessage(), ex);
    }

    private List<OpenAiChatClient.Message> buildMessages(AssembledPrompt prompt) {
        List<OpenAiChatClient.Message> messages = new ArrayList<>();
        messages.add(new OpenAiChatClient.Message("system", prompt.systemPrompt()));
        for (ChatTurn turn : prompt.conversation()) {
            String role = turn.role() == ChatMessageRole.USER ? "user" : "assistant";
            messages.add(new OpenAiChatClient.Message(role, turn.content()));
        }
        return List.copyOf(messages);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record StreamResponse(List<StreamChoice> choices, StreamError error) {

        private StreamChoice firstChoice() {
            return choices == null || choices.isEmpty() ? null : choices.get(0);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record StreamChoice(StreamDelta delta, @JsonProperty("finish_reason") String finishReason) {
    }

    // In-band failure reported by the service after the stream has started, e.g. an exhausted quota.
    @JsonIgnoreProperties(ignoreUnknown = true)
    private record StreamError(String message, String type) {

        private String describe() {
            if (message != null && !message.isBlank()) {
                return message;
            }
            return type == null || type.isBlank() ? "Generation service reported an error" : type;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record StreamDelta(@JsonProperty("content") String content) {
    }
}
