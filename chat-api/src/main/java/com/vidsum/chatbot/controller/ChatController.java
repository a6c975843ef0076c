package com.vidsum.chatbot.controller;

import com.vidsum.chatbot.codec.StreamEventCodec;
import com.vidsum.chatbot.model.ChatRequest;
import com.vidsum.chatbot.model.ChatResponse;
import com.vidsum.chatbot.service.ChatService;
import jakarta.validation.Valid;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferFactory;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;

@RestController
@RequestMapping("/api/chat")
public class ChatController {

    private final ChatService chatService;
    private final StreamEventCodec codec;

    public ChatController(ChatService chatService, StreamEventCodec codec) {
        this.chatService = chatService;
        this.codec = codec;
    }

    /**
     * Writes one {@code data: <json>} frame per event and flushes each frame as soon as it is
     * produced. A client disconnect cancels the event stream and with it the upstream generation.
     */
    @PostMapping(path = "/stream", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Mono<Void> stream(@Valid @RequestBody ChatRequest request, ServerHttpResponse response) {
        response.getHeaders().setContentType(MediaType.TEXT_EVENT_STREAM);
        response.getHeaders().setCacheControl(CacheControl.noCache());
        response.getHeaders().set("X-Accel-Buffering", "no");
        DataBufferFactory bufferFactory = response.bufferFactory();
        Flux<Mono<DataBuffer>> frames = chatService.streamChat(request)
                .map(codec::encode)
                .map(frame -> Mono.just(bufferFactory.wrap(frame.getBytes(StandardCharsets.UTF_8))));
        return response.writeAndFlushWith(frames);
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ChatResponse> chat(@Valid @RequestBody ChatRequest request) {
        return chatService.completeChat(request);
    }
}
