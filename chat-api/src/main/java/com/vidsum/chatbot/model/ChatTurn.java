package com.vidsum.chatbot.model;

import jakarta.validation.constraints.NotNull;

public record ChatTurn(
        @NotNull ChatMessageRole role,
        @NotNull String content
) {
}
