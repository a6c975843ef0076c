package com.vidsum.chatbot.service.retrieval;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vidsum.chatbot.model.RetrievalResult;
import com.vidsum.chatbot.telemetry.LogValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeoutException;

@Component
public class SemanticIndexRetriever implements Retriever {

    private static final Logger log = LoggerFactory.getLogger(SemanticIndexRetriever.class);

    private final WebClient retrievalWebClient;
    private final String collection;
    private final Duration timeout;

    public SemanticIndexRetriever(@Qualifier("retrievalWebClient") WebClient retrievalWebClient,
                                  @Value("${chat.retrieval.collection:video_summaries}") String collection,
                                  @Value("${chat.retrieval.timeout-seconds:10}") long timeoutSeconds) {
        this.retrievalWebClient = retrievalWebClient;
        this.collection = collection;
        this.timeout = Duration.ofSeconds(Math.max(1, timeoutSeconds));
    }

    @Override
    public Mono<List<RetrievalResult>> search(String query, int k, double threshold) {
        if (k <= 0) {
            return Mono.just(List.of());
        }
        SearchPayload payload = new SearchPayload(query, k, threshold, true);
        return retrievalWebClient.post()
                .uri("/collections/{collection}/points/search", collection)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(payload)
                .retrieve()
                .bodyToMono(SearchResponse.class)
                .timeout(timeout)
                .onErrorMap(this::toUnavailable)
                .map(response -> RankedPassages.rank(response.toResults(), k, threshold))
                .defaultIfEmpty(List.of())
                .doOnNext(results -> log.info("Index search returned {} passages for query: {}",
                        results.size(), LogValues.abbreviate(query, 100)));
    }

    private Throwable toUnavailable(Throwable throwable) {
        if (throwable instanceof RetrievalUnavailableException) {
            return throwable;
        }
        if (throwable instanceof TimeoutException) {
            return new RetrievalUnavailableException("Semantic index timed out after " + timeout.toSeconds() + "s", throwable);
        }
        if (throwable instanceof WebClientResponseException responseException) {
            return new RetrievalUnavailableException(
                    "Semantic index returned " + responseException.getStatusCode().value(), throwable);
        }
        return new RetrievalUnavailableException("Semantic index unreachable: " + throwable.getMessage(), throwable);
    }

    private record SearchPayload(String query,
                                 int limit,
                                 @JsonProperty("score_threshold") double scoreThreshold,
                                 @JsonProperty("with_payload") boolean withPayload) {
    }

    private record SearchResponse(List<Hit> result) {
        List<RetrievalResult> toResults() {
            return result == null ? Collections.emptyList() : result.stream().map(Hit::toResult).toList();
        }
    }

    private record Hit(double score, Payload payload) {
        RetrievalResult toResult() {
            if (payload == null) {
                return new RetrievalResult("", "", score);
            }
            return new RetrievalResult(
                    payload.text() == null ? "" : payload.text(),
                    payload.sourceUri() == null ? "" : payload.sourceUri(),
                    score);
        }
    }

    private record Payload(String text, @JsonProperty("source_uri") String sourceUri) {
    }
}
