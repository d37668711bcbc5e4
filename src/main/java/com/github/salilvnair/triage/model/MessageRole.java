package com.github.salilvnair.triage.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MessageRole {
    SYSTEM,
    USER,
    ASSISTANT;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static MessageRole fromWireValue(String value) {
        if (value == null || value.isBlank()) {
            return USER;
        }
        return MessageRole.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
