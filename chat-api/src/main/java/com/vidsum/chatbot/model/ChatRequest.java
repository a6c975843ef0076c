package com.vidsum.chatbot.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record ChatRequest(
        @NotEmpty List<@Valid ChatTurn> messages,
        @JsonProperty("session_id") String sessionId
) {
}
