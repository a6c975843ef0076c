package com.vidsum.chatbot.service.generation.openai;

public class OpenAiChatException extends RuntimeException {

    public OpenAiChatException(String message) {
        super(message);
    }

    public OpenAiChatException(String message, Throwable cause) {
        super(message, cause);
    }
}
