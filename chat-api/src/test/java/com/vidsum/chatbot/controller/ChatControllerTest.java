package com.vidsum.chatbot.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidsum.chatbot.codec.StreamEventCodec;
import com.vidsum.chatbot.model.ChatMessageRole;
import com.vidsum.chatbot.model.ChatRequest;
import com.vidsum.chatbot.model.ChatResponse;
import com.vidsum.chatbot.model.Source;
import com.vidsum.chatbot.model.StreamEvent;
import com.vidsum.chatbot.service.ChatService;
import com.vidsum.chatbot.service.ChatServiceUnavailableException;
import com.vidsum.chatbot.service.generation.GenerationFailedException;
import com.vidsum.chatbot.service.guardrail.GuardrailDirection;
import com.vidsum.chatbot.service.guardrail.GuardrailUnavailableException;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ChatControllerTest {

    private static final String QUESTION = """
            {"messages": [{"role": "user", "content": "What is RAG?"}], "session_id": "abc"}
            """;

    private final ChatService chatService = mock(ChatService.class);
    private final WebTestClient client = WebTestClient
            .bindToController(new ChatController(chatService, new StreamEventCodec(new ObjectMapper())))
            .controllerAdvice(new GlobalExceptionHandler())
            .build();

    @Test
    void streamWritesOneDataFramePerEvent() {
        when(chatService.streamChat(any())).thenReturn(Flux.just(
                StreamEvent.chunk("RAG "),
                StreamEvent.chunk("combines search."),
                StreamEvent.sources(List.of(new Source("s3://kb/rag_intro.md", 0.82))),
                StreamEvent.done("abc")));

        byte[] body = client.post().uri("/api/chat/stream")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .bodyValue(QUESTION)
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentTypeCompatibleWith(MediaType.TEXT_EVENT_STREAM)
                .expectHeader().cacheControl(CacheControl.noCache())
                .expectHeader().valueEquals("X-Accel-Buffering", "no")
                .expectBody(byte[].class)
                .returnResult()
                .getResponseBody();

        assertThat(new String(body, StandardCharsets.UTF_8)).isEqualTo(
                "data: {\"type\":\"chunk\",\"content\":\"RAG \"}\n\n"
                        + "data: {\"type\":\"chunk\",\"content\":\"combines search.\"}\n\n"
                        + "data: {\"type\":\"sources\",\"sources\":[{\"source_uri\":\"s3://kb/rag_intro.md\",\"score\":0.82}]}\n\n"
                        + "data: {\"type\":\"done\",\"session_id\":\"abc\"}\n\n");

        ArgumentCaptor<ChatRequest> request = ArgumentCaptor.forClass(ChatRequest.class);
        verify(chatService).streamChat(request.capture());
        assertThat(request.getValue().sessionId()).isEqualTo("abc");
        assertThat(request.getValue().messages()).hasSize(1);
        assertThat(request.getValue().messages().get(0).role()).isEqualTo(ChatMessageRole.USER);
    }

    @Test
    void emptyMessageListIsRejectedBeforeStreaming() {
        client.post().uri("/api/chat/stream")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .bodyValue("{\"messages\": []}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.detail").value(detail -> assertThat((String) detail).contains("messages"));

        verify(chatService, never()).streamChat(any());
    }

    @Test
    void unconfiguredKnowledgeBaseIsServiceUnavailable() {
        when(chatService.streamChat(any()))
                .thenReturn(Flux.error(new ChatServiceUnavailableException("Knowledge Base not configured")));

        client.post().uri("/api/chat/stream")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .bodyValue(QUESTION)
                .exchange()
                .expectStatus().isEqualTo(HttpStatus.SERVICE_UNAVAILABLE)
                .expectHeader().contentTypeCompatibleWith(MediaType.APPLICATION_JSON)
                .expectBody()
                .jsonPath("$.detail").isEqualTo("Knowledge Base not configured");
    }

    @Test
    void unavailableInputModerationIsServiceUnavailable() {
        when(chatService.streamChat(any())).thenReturn(Flux.error(new GuardrailUnavailableException(
                GuardrailDirection.INPUT, "Moderation service returned 500", null)));

        client.post().uri("/api/chat/stream")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .bodyValue(QUESTION)
                .exchange()
                .expectStatus().isEqualTo(HttpStatus.SERVICE_UNAVAILABLE)
                .expectBody()
                .jsonPath("$.detail").isEqualTo("Moderation service unavailable");
    }

    @Test
    void nonStreamingChatReturnsCompleteAnswer() {
        when(chatService.completeChat(any())).thenReturn(Mono.just(new ChatResponse(
                "RAG combines search.", List.of(new Source("s3://kb/rag_intro.md", 0.82)), "abc")));

        client.post().uri("/api/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(QUESTION)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.content").isEqualTo("RAG combines search.")
                .jsonPath("$.sources[0].source_uri").isEqualTo("s3://kb/rag_intro.md")
                .jsonPath("$.sources[0].score").isEqualTo(0.82)
                .jsonPath("$.session_id").isEqualTo("abc");
    }

    @Test
    void nonStreamingGenerationFailureIsBadGateway() {
        when(chatService.completeChat(any())).thenReturn(Mono.error(new GenerationFailedException("quota exceeded")));

        client.post().uri("/api/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(QUESTION)
                .exchange()
                .expectStatus().isEqualTo(HttpStatus.BAD_GATEWAY)
                .expectBody()
                .jsonPath("$.detail").isEqualTo("quota exceeded");
    }

    @Test
    void unexpectedFailureBeforeStreamingStillCarriesDetail() {
        when(chatService.streamChat(any())).thenReturn(Flux.error(new IllegalStateException("bean wiring broke")));

        client.post().uri("/api/chat/stream")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .bodyValue(QUESTION)
                .exchange()
                .expectStatus().isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR)
                .expectHeader().contentTypeCompatibleWith(MediaType.APPLICATION_JSON)
                .expectBody()
                .jsonPath("$.detail").isEqualTo("Internal server error");
    }

    @Test
    void unsupportedContentTypeKeepsItsStatus() {
        client.post().uri("/api/chat")
                .contentType(MediaType.TEXT_PLAIN)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue("What is RAG?")
                .exchange()
                .expectStatus().isEqualTo(HttpStatus.UNSUPPORTED_MEDIA_TYPE);
    }
}
