package com.vidsum.chatbot.controller;

import com.vidsum.chatbot.service.guardrail.GuardrailGate;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.reactive.server.WebTestClient;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ServiceInfoControllerTest {

    private final GuardrailGate guardrailGate = mock(GuardrailGate.class);

    @Test
    void healthReportsConfigurationState() {
        when(guardrailGate.configured()).thenReturn(false);
        WebTestClient client = WebTestClient
                .bindToController(new ServiceInfoController(guardrailGate, "video_summaries", "1.0.0"))
                .build();

        client.get().uri("/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("healthy")
                .jsonPath("$.service").isEqualTo("youtube-summaries-chatbot")
                .jsonPath("$.knowledge_base_configured").isEqualTo(true)
                .jsonPath("$.guardrail_configured").isEqualTo(false);
    }

    @Test
    void rootListsEndpoints() {
        WebTestClient client = WebTestClient
                .bindToController(new ServiceInfoController(guardrailGate, "", "2.1.0"))
                .build();

        client.get().uri("/")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.version").isEqualTo("2.1.0")
                .jsonPath("$.endpoints['POST /api/chat/stream']").exists();
    }
}
