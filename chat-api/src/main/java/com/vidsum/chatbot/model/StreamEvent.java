package com.vidsum.chatbot.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.List;
import java.util.Objects;

/**
 * One event of a chat stream. The set of variants is closed; the {@code type} property of the
 * JSON payload selects the variant.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = StreamEvent.Chunk.class, name = "chunk"),
        @JsonSubTypes.Type(value = StreamEvent.Sources.class, name = "sources"),
        @JsonSubTypes.Type(value = StreamEvent.Done.class, name = "done"),
        @JsonSubTypes.Type(value = StreamEvent.Error.class, name = "error")
})
public sealed interface StreamEvent {

    static StreamEvent chunk(String content) {
        return new Chunk(content);
    }

    static StreamEvent sources(List<Source> sources) {
        return new Sources(sources);
    }

    static StreamEvent done(String sessionId) {
        return new Done(sessionId);
    }

    static StreamEvent error(String detail) {
        return new Error(detail);
    }

    /** Whether this event ends the stream. */
    default boolean terminal() {
        return false;
    }

    @JsonTypeName("chunk")
    record Chunk(String content) implements StreamEvent {
        public Chunk {
            Objects.requireNonNull(content, "content");
        }
    }

    @JsonTypeName("sources")
    record Sources(List<Source> sources) implements StreamEvent {
        public Sources {
            sources = sources == null ? List.of() : List.copyOf(sources);
        }
    }

    @JsonTypeName("done")
    record Done(@JsonProperty("session_id") String sessionId) implements StreamEvent {
        @Override
        public boolean terminal() {
            return true;
        }
    }

    @JsonTypeName("error")
    record Error(String detail) implements StreamEvent {
        @Override
        public boolean terminal() {
            return true;
        }
    }
}
