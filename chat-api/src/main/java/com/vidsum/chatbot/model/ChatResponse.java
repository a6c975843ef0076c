package com.vidsum.chatbot.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ChatResponse(
        String content,
        List<Source> sources,
        @JsonProperty("session_id") String sessionId
) {
}
