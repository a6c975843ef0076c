package com.vidsum.chatbot.model;

import java.util.List;

public record ChatMessage(
        ChatMessageRole role,
        String content,
        List<Source> sources
) {

    public ChatMessage {
        content = content == null ? "" : content;
        sources = sources == null ? List.of() : List.copyOf(sources);
    }

    public static ChatMessage assistant(String content, List<Source> sources) {
        return new ChatMessage(ChatMessageRole.ASSISTANT, content, sources);
    }

    public static ChatMessage error(String detail) {
        return new ChatMessage(ChatMessageRole.ERROR, detail, List.of());
    }
}
