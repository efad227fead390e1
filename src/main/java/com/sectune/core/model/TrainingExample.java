package com.sectune.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * One system/user/assistant fine-tuning unit derived from a conversation.
 */
public record TrainingExample(
    String conversationId,
    String systemPrompt,
    String userMessage,
    String assistantResponse,
    double qualityScore,
    ThreatCategory threatCategory
) implements Serializable {

    /**
     * Chat-format view of the example. Absent parts are omitted, so a well-formed
     * example yields system, user and assistant messages in that order.
     */
    public List<ChatMessage> messages() {
        var messages = new ArrayList<ChatMessage>(3);
        if (systemPrompt != null) {
            messages.add(new ChatMessage(MessageRole.SYSTEM, systemPrompt, messages.size()));
        }
        if (userMessage != null) {
            messages.add(new ChatMessage(MessageRole.USER, userMessage, messages.size()));
        }
        if (assistantResponse != null) {
            messages.add(new ChatMessage(MessageRole.ASSISTANT, assistantResponse, messages.size()));
        }
        return List.copyOf(messages);
    }
}
