package com.vidsum.chatbot.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A document that contributed to an answer. The score is the similarity of the best matching
 * passage from that document, clamped to {@code [0, 1]}.
 */
public record Source(
        @JsonProperty("source_uri") String uri,
        double score
) {

    public Source {
        if (Double.isNaN(score) || score < 0d) {
            score = 0d;
        } else if (score > 1d) {
            score = 1d;
        }
    }
}
