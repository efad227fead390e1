package com.sectune.core.model;

/**
 * Author of a conversation message.
 */
public enum MessageRole {
    SYSTEM,
    USER,
    ASSISTANT;

    /** Lower-case wire name, as used in chat-completion payloads. */
    public String wireName() {
        return name().toLowerCase();
    }

    public static MessageRole fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Message role must not be null");
        }
        return MessageRole.valueOf(value.trim().toUpperCase());
    }
}
