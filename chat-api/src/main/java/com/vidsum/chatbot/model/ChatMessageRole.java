package com.vidsum.chatbot.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ChatMessageRole {
    USER,
    ASSISTANT,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ChatMessageRole fromWireName(String value) {
        if (value == null) {
            return null;
        }
        return ChatMessageRole.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
