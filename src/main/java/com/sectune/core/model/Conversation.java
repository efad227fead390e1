package com.sectune.core.model;

import java.io.Serializable;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An immutable, ordered conversation read from the chat system's store.
 */
public record Conversation(
    String id,
    List<ChatMessage> messages
) implements Serializable {

    public Conversation {
        messages = messages == null ? List.of()
                : messages.stream()
                        .sorted(Comparator.comparingInt(ChatMessage::sequenceIndex))
                        .toList();
    }

    public int messageCount() {
        return messages.size();
    }

    /**
     * Joins the content of every message with the given role, separated by a blank line.
     * Returns null when the conversation has no non-blank message with that role.
     */
    public String joinedContent(MessageRole role) {
        String joined = messages.stream()
                .filter(m -> m.role() == role)
                .map(ChatMessage::content)
                .filter(c -> c != null && !c.isBlank())
                .map(String::strip)
                .collect(Collectors.joining("\n\n"));
        return joined.isEmpty() ? null : joined;
    }
}
