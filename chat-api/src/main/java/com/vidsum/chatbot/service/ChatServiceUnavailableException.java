package com.vidsum.chatbot.service;

public class ChatServiceUnavailableException extends RuntimeException {

    public ChatServiceUnavailableException(String message) {
        super(message);
    }
}
