package com.vidsum.chatbot.client;

import com.vidsum.chatbot.model.Source;
import com.vidsum.chatbot.model.StreamEvent;
import com.vidsum.chatbot.telemetry.LogValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Folds stream events into the reply being displayed.
 */
public class ReplyAccumulator {

    private static final Logger log = LoggerFactory.getLogger(ReplyAccumulator.class);

    private final StringBuilder content = new StringBuilder();
    private List<Source> sources = List.of();
    private String sessionId;
    private String errorDetail;
    private boolean completed;

    public ReplyAccumulator apply(StreamEvent event) {
        if (completed) {
            log.debug("Ignoring {} received after the stream ended", event.getClass().getSimpleName());
            return this;
        }
        if (event instanceof StreamEvent.Chunk chunk) {
            content.append(chunk.content());
        } else if (event instanceof StreamEvent.Sources update) {
            sources = update.sources();
        } else if (event instanceof StreamEvent.Done done) {
            sessionId = done.sessionId();
        } else if (event instanceof StreamEvent.Error error) {
            log.warn("Chat stream reported an error: {}", LogValues.abbreviate(error.detail(), 200));
            errorDetail = error.detail() == null || error.detail().isBlank() ? "The assistant failed to answer." : error.detail();
        } else {
            throw new IllegalStateException("Unhandled stream event " + event);
        }
        completed = event.terminal();
        return this;
    }

    public ReplySnapshot snapshot() {
        return new ReplySnapshot(content.toString(), sources, sessionId, errorDetail, completed);
    }
}
