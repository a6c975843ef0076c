package com.vidsum.chatbot.model;

public record RetrievalResult(
        String text,
        String uri,
        double score
) {
}
