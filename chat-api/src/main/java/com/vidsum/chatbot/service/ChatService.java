package com.vidsum.chatbot.service;

import com.vidsum.chatbot.model.ChatRequest;
import com.vidsum.chatbot.model.ChatResponse;
import com.vidsum.chatbot.model.StreamEvent;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface ChatService {

    Flux<StreamEvent> streamChat(ChatRequest request);

    Mono<ChatResponse> completeChat(ChatRequest request);
}
