package com.vidsum.chatbot.client;

import com.vidsum.chatbot.codec.StreamEventCodec;
import com.vidsum.chatbot.model.ChatRequest;
import com.vidsum.chatbot.model.StreamEvent;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Consumes {@code POST /api/chat/stream} and turns the raw byte stream into display snapshots.
 * Cancelling the returned {@link Flux} closes the connection, which stops generation server side.
 */
public class ChatStreamClient {

    private final WebClient webClient;
    private final StreamEventCodec codec;

    public ChatStreamClient(WebClient webClient, StreamEventCodec codec) {
        this.webClient = webClient;
        this.codec = codec;
    }

    /**
     * Emits a snapshot after every network read that completed at least one event, then a last one
     * when the body ends.
     */
    public Flux<ReplySnapshot> stream(ChatRequest request) {
        return Flux.defer(() -> {
            StreamFrameDecoder decoder = new StreamFrameDecoder(codec);
            ReplyAccumulator accumulator = new ReplyAccumulator();
            Flux<List<StreamEvent>> reads = webClient.post()
                    .uri("/api/chat/stream")
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.TEXT_EVENT_STREAM, MediaType.APPLICATION_JSON)
                    .bodyValue(request)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, this::toClientException)
                    .bodyToFlux(DataBuffer.class)
                    .map(buffer -> decoder.feed(drain(buffer)))
                    .concatWith(Mono.fromSupplier(decoder::finish));
            return reads
                    .filter(events -> !events.isEmpty())
                    .map(events -> {
                        events.forEach(accumulator::apply);
                        return accumulator.snapshot();
                    });
        });
    }

    /** The final state of the reply. */
    public Mono<ReplySnapshot> send(ChatRequest request) {
        return stream(request)
                .last(new ReplySnapshot("", List.of(), null, null, false));
    }

    private Mono<? extends Throwable> toClientException(ClientResponse response) {
        return response.bodyToMono(ErrorBody.class)
                .map(body -> body.detail() == null ? response.statusCode().toString() : body.detail())
                .onErrorReturn(response.statusCode().toString())
                .defaultIfEmpty(response.statusCode().toString())
                .map(detail -> new ChatClientException(response.statusCode().value(), detail));
    }

    private static byte[] drain(DataBuffer buffer) {
        try {
            byte[] bytes = new byte[buffer.readableByteCount()];
            buffer.read(bytes);
            return bytes;
        } finally {
            DataBufferUtils.release(buffer);
        }
    }

    private record ErrorBody(String detail) {
    }
}
