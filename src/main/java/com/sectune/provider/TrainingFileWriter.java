package com.sectune.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sectune.core.model.ChatMessage;
import com.sectune.core.model.TrainingExample;

import java.util.List;

/**
 * Serializes training examples into the chat fine-tuning JSONL format:
 * one {@code {"messages":[{"role":..,"content":..}, ...]}} object per line.
 */
public class TrainingFileWriter {

    private final ObjectMapper objectMapper;

    public TrainingFileWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String toJsonl(List<TrainingExample> examples) {
        var out = new StringBuilder();
        for (TrainingExample example : examples) {
            out.append(toLine(example)).append('\n');
        }
        return out.toString();
    }

    String toLine(TrainingExample example) {
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode messages = root.putArray("messages");
        for (ChatMessage message : example.messages()) {
            messages.addObject()
                    .put("role", message.role().wireName())
                    .put("content", message.content());
        }
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize training example for "
                    + example.conversationId(), e);
        }
    }
}
