package com.sectune.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConversationTest {

    @Test
    @DisplayName("Messages are ordered by sequence index")
    void ordersMessages() {
        var conversation = new Conversation("c1", List.of(
                new ChatMessage(MessageRole.ASSISTANT, "second", 1),
                new ChatMessage(MessageRole.USER, "first", 0)));

        assertEquals("first", conversation.messages().get(0).content());
        assertEquals(2, conversation.messageCount());
    }

    @Test
    @DisplayName("joinedContent joins one role with blank lines and skips blanks")
    void joinedContent() {
        var conversation = new Conversation("c1", List.of(
                new ChatMessage(MessageRole.SYSTEM, "be helpful", 0),
                new ChatMessage(MessageRole.USER, " first question ", 1),
                new ChatMessage(MessageRole.ASSISTANT, "answer", 2),
                new ChatMessage(MessageRole.USER, "  ", 3),
                new ChatMessage(MessageRole.USER, null, 4),
                new ChatMessage(MessageRole.USER, "follow-up", 5)));

        assertEquals("first question\n\nfollow-up", conversation.joinedContent(MessageRole.USER));
        assertEquals("answer", conversation.joinedContent(MessageRole.ASSISTANT));
    }

    @Test
    @DisplayName("joinedContent is null when the role never speaks")
    void joinedContentAbsent() {
        var conversation = new Conversation("c1", List.of(ChatMessage.user("hello there")));
        assertNull(conversation.joinedContent(MessageRole.ASSISTANT));
    }

    @Test
    @DisplayName("ThreatCategory.fromLabel accepts labels, display names and hyphens")
    void threatCategoryFromLabel() {
        assertEquals(ThreatCategory.NETWORK_INTRUSION, ThreatCategory.fromLabel("network_intrusion").orElseThrow());
        assertEquals(ThreatCategory.NETWORK_INTRUSION, ThreatCategory.fromLabel("Network Intrusion").orElseThrow());
        assertEquals(ThreatCategory.DATA_BREACH, ThreatCategory.fromLabel("data-breach").orElseThrow());
        assertTrue(ThreatCategory.fromLabel("ransom").isEmpty());
        assertTrue(ThreatCategory.fromLabel(null).isEmpty());
    }
}
