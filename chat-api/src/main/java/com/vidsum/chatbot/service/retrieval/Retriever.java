package com.vidsum.chatbot.service.retrieval;

import com.vidsum.chatbot.model.RetrievalResult;
import reactor.core.publisher.Mono;

import java.util.List;

public interface Retriever {

    /**
     * Searches the semantic index for passages relevant to {@code query}.
     *
     * @return at most {@code k} passages scoring at least {@code threshold}, best first. A source
     * may appear more than once. Signals {@link RetrievalUnavailableException} when the index
     * cannot be reached or times out.
     */
    Mono<List<RetrievalResult>> search(String query, int k, double threshold);
}
