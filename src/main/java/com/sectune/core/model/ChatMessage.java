package com.sectune.core.model;

import java.io.Serializable;

/**
 * A single message of a conversation or training example.
 *
 * @param role          who wrote the message
 * @param content       message text (may be null for malformed input)
 * @param sequenceIndex position within the owning conversation
 */
public record ChatMessage(
    MessageRole role,
    String content,
    int sequenceIndex
) implements Serializable {

    public static ChatMessage system(String content) {
        return new ChatMessage(MessageRole.SYSTEM, content, 0);
    }

    public static ChatMessage user(String content) {
        return new ChatMessage(MessageRole.USER, content, 0);
    }

    public static ChatMessage assistant(String content) {
        return new ChatMessage(MessageRole.ASSISTANT, content, 0);
    }
}
