package com.vidsum.chatbot.controller;

import com.vidsum.chatbot.service.guardrail.GuardrailGate;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class ServiceInfoController {

    static final String SERVICE_NAME = "youtube-summaries-chatbot";

    private final GuardrailGate guardrailGate;
    private final String knowledgeBase;
    private final String version;

    public ServiceInfoController(GuardrailGate guardrailGate,
                                 @Value("${chat.retrieval.collection:video_summaries}") String knowledgeBase,
                                 @Value("${chat.version:1.0.0}") String version) {
        this.guardrailGate = guardrailGate;
        this.knowledgeBase = knowledgeBase;
        this.version = version;
    }

    @GetMapping("/")
    public Map<String, Object> root() {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("GET /", "This service description");
        endpoints.put("GET /health", "Health check");
        endpoints.put("POST /api/chat", "Chat (non-streaming)");
        endpoints.put("POST /api/chat/stream", "Chat (streaming, text/event-stream)");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", "YouTube Summaries Chatbot");
        body.put("version", version);
        body.put("endpoints", endpoints);
        return body;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("service", SERVICE_NAME);
        body.put("knowledge_base_configured", knowledgeBase != null && !knowledgeBase.isBlank());
        body.put("guardrail_configured", guardrailGate.configured());
        return body;
    }
}
