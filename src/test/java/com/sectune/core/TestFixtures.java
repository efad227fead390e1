package com.sectune.core;

import com.sectune.core.model.ChatMessage;
import com.sectune.core.model.ClassificationRecord;
import com.sectune.core.model.ClassificationResult;
import com.sectune.core.model.Conversation;
import com.sectune.core.model.MessageRole;
import com.sectune.core.model.ThreatCategory;
import com.sectune.core.persistence.InMemoryTrainingStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Shared conversations and store seeding for tests.
 */
public final class TestFixtures {

    private TestFixtures() {}

    public static Conversation conversation(String id, String... alternatingUserAssistant) {
        var messages = new ArrayList<ChatMessage>();
        for (int i = 0; i < alternatingUserAssistant.length; i++) {
            var role = i % 2 == 0 ? MessageRole.USER : MessageRole.ASSISTANT;
            messages.add(new ChatMessage(role, alternatingUserAssistant[i], i));
        }
        return new Conversation(id, messages);
    }

    /** Three-message malware conversation matching trojan, hash and quarantine. */
    public static Conversation malwareConversation(String id) {
        return conversation(id,
                "I think my laptop picked up a trojan from an email.",
                "Compute the file hash and compare it with known samples.",
                "Should I quarantine the file before doing anything else?");
    }

    public static Conversation genericConversation(String id) {
        return conversation(id,
                "What should I cook for dinner tonight?",
                "How about pasta with tomato sauce and basil?",
                "Sounds great, thanks for the idea!");
    }

    public static ClassificationRecord qualifyingRecord(String conversationId, double confidence,
                                                        ThreatCategory category, Instant classifiedAt) {
        return ClassificationRecord.unclaimed(conversationId,
                new ClassificationResult(true, confidence, category, Set.of("trojan", "hash")),
                classifiedAt);
    }

    /**
     * Stores {@code count} malware conversations with qualifying records and
     * returns their ids in claim order.
     */
    public static List<String> seedQualifying(InMemoryTrainingStore store, int count, double confidence) {
        var ids = new ArrayList<String>();
        Instant base = Instant.parse("2026-01-01T00:00:00Z");
        for (int i = 0; i < count; i++) {
            String id = "conv-%03d".formatted(i);
            store.putConversation(malwareConversation(id));
            store.saveClassification(qualifyingRecord(id, confidence, ThreatCategory.MALWARE, base.plusSeconds(i)));
            ids.add(id);
        }
        return ids;
    }

    /** Stores a conversation whose formatted example fails validation (content too short). */
    public static void seedInvalid(InMemoryTrainingStore store, String id, Instant classifiedAt) {
        store.putConversation(conversation(id, "trojan?", "hash it", "ok"));
        store.saveClassification(qualifyingRecord(id, 0.9, ThreatCategory.MALWARE, classifiedAt));
    }
}
