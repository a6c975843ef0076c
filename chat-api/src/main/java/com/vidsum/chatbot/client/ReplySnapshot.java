package com.vidsum.chatbot.client;

import com.vidsum.chatbot.model.ChatMessage;
import com.vidsum.chatbot.model.Source;

import java.util.ArrayList;
import java.util.List;

/**
 * Display state of one assistant reply at a point in the stream.
 *
 * @param errorDetail set when the stream ended with an error event
 * @param completed   whether a terminal event has been seen
 */
public record ReplySnapshot(String content,
                            List<Source> sources,
                            String sessionId,
                            String errorDetail,
                            boolean completed) {

    public ReplySnapshot {
        content = content == null ? "" : content;
        sources = sources == null ? List.of() : List.copyOf(sources);
    }

    public boolean failed() {
        return errorDetail != null;
    }

    /**
     * Messages to render for this reply. A failure is rendered as its own error message after
     * whatever partial answer was already shown.
     */
    public List<ChatMessage> messages() {
        List<ChatMessage> messages = new ArrayList<>(2);
        if (!content.isEmpty()) {
            messages.add(ChatMessage.assistant(content, failed() ? List.of() : sources));
        }
        if (failed()) {
            messages.add(ChatMessage.error(errorDetail));
        }
        return List.copyOf(messages);
    }
}
