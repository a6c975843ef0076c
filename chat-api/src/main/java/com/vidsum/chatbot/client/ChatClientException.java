package com.vidsum.chatbot.client;

public class ChatClientException extends RuntimeException {

    private final int status;

    public ChatClientException(int status, String detail) {
        super(detail);
        this.status = status;
    }

    public int status() {
        return status;
    }

    public String detail() {
        return getMessage();
    }
}
