package com.vidsum.chatbot.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.vidsum.chatbot.model.StreamEvent;
import com.vidsum.chatbot.telemetry.LogValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Line oriented framing for chat streams: every event is one {@code data: <json>} line followed
 * by a blank line.
 */
@Component
public class StreamEventCodec {

    private static final Logger log = LoggerFactory.getLogger(StreamEventCodec.class);

    public static final String DATA_PREFIX = "data: ";
    public static final String FRAME_SEPARATOR = "\n\n";

    private final ObjectWriter writer;
    private final ObjectReader reader;

    public StreamEventCodec(ObjectMapper objectMapper) {
        this.writer = objectMapper.writerFor(StreamEvent.class);
        this.reader = objectMapper.readerFor(StreamEvent.class);
    }

    public String encode(StreamEvent event) {
        try {
            return DATA_PREFIX + writer.writeValueAsString(event) + FRAME_SEPARATOR;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize stream event " + event.getClass().getSimpleName(), e);
        }
    }

    /**
     * Parses one complete line. Lines that are not data frames, do not hold valid JSON or carry an
     * unknown event type yield an empty result.
     */
    public Optional<StreamEvent> decodeLine(String line) {
        if (line == null) {
            return Optional.empty();
        }
        String trimmed = line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
        if (!trimmed.startsWith(DATA_PREFIX)) {
            return Optional.empty();
        }
        String json = trimmed.substring(DATA_PREFIX.length());
        try {
            StreamEvent event = reader.readValue(json);
            return Optional.ofNullable(event);
        } catch (JsonProcessingException e) {
            log.warn("Skipping malformed stream frame: {} ({})", LogValues.abbreviate(json, 120), e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
