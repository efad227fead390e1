package com.sectune.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sectune.core.model.ThreatCategory;
import com.sectune.core.model.TrainingExample;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TrainingFileWriterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final TrainingFileWriter writer = new TrainingFileWriter(objectMapper);

    @Test
    @DisplayName("Each example becomes one chat-format JSON line")
    void writesChatLines() throws Exception {
        var examples = List.of(
                new TrainingExample("c1", "You are an analyst.", "Is this a trojan?\nIt hides.", "Quarantine it.", 0.9,
                        ThreatCategory.MALWARE),
                new TrainingExample("c2", "You are an analyst.", "Spoofed sender?", "Yes, report it.", 0.8,
                        ThreatCategory.PHISHING));

        String jsonl = writer.toJsonl(examples);
        String[] lines = jsonl.split("\n");

        assertEquals(2, lines.length);
        var first = objectMapper.readTree(lines[0]);
        var messages = first.get("messages");
        assertEquals(3, messages.size());
        assertEquals("system", messages.get(0).get("role").asText());
        assertEquals("user", messages.get(1).get("role").asText());
        assertEquals("Is this a trojan?\nIt hides.", messages.get(1).get("content").asText());
        assertEquals("assistant", messages.get(2).get("role").asText());
        assertTrue(jsonl.endsWith("\n"));
    }

    @Test
    @DisplayName("Only the messages array is written")
    void noExtraFields() throws Exception {
        var line = writer.toLine(new TrainingExample("c1", "system prompt", "user text", "reply text", 1.0, null));

        var node = objectMapper.readTree(line);
        assertEquals(List.of("messages"), iterableToList(node.fieldNames()));
    }

    private static List<String> iterableToList(Iterator<String> it) {
        var list = new ArrayList<String>();
        it.forEachRemaining(list::add);
        return list;
    }
}
