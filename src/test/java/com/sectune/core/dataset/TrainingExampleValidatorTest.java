package com.sectune.core.dataset;

import com.sectune.core.model.ThreatCategory;
import com.sectune.core.model.TrainingExample;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TrainingExampleValidatorTest {

    private static final String SYSTEM = "You are a cybersecurity analyst assistant.";

    private final TrainingExampleValidator validator = new TrainingExampleValidator();

    private static TrainingExample example(String system, String user, String assistant) {
        return new TrainingExample("c", system, user, assistant, 0.9, ThreatCategory.MALWARE);
    }

    private static TrainingExample good() {
        return example(SYSTEM, "How do I remove this trojan?", "Boot into safe mode and run a full scan.");
    }

    @Test
    @DisplayName("Well-formed example is valid")
    void validExample() {
        var report = validator.validateBatch(List.of(good()));

        assertEquals(1, report.valid().size());
        assertTrue(report.invalid().isEmpty());
        assertTrue(report.errors().isEmpty());
    }

    @Test
    @DisplayName("Missing system prompt is reported")
    void missingSystemPrompt() {
        var report = validator.validateBatch(List.of(
                example(null, "How do I remove this trojan?", "Boot into safe mode and scan.")));

        var rules = report.errors().stream().map(ValidationError::rule).toList();
        assertEquals(List.of(ValidationRule.MISSING_SYSTEM_PROMPT), rules);
    }

    @Test
    @DisplayName("Single-message example has too few messages")
    void tooFewMessages() {
        var report = validator.validateBatch(List.of(example(SYSTEM, null, null)));

        var rules = report.errors().stream().map(ValidationError::rule).toList();
        assertTrue(rules.contains(ValidationRule.TOO_FEW_MESSAGES));
    }

    @Test
    @DisplayName("Content length bounds: 10 is the minimum, 4000 is already too long")
    void contentBounds() {
        var atMin = example(SYSTEM, "a".repeat(10), "b".repeat(3999));
        var tooShort = example(SYSTEM, "a".repeat(9), "b".repeat(20));
        var tooLong = example(SYSTEM, "a".repeat(20), "b".repeat(4000));

        var report = validator.validateBatch(List.of(atMin, tooShort, tooLong));

        assertEquals(List.of(atMin), report.valid());
        assertEquals(2, report.invalid().size());

        var shortError = report.invalid().get(0).errors().get(0);
        assertEquals(ValidationRule.CONTENT_TOO_SHORT, shortError.rule());
        assertEquals(1, shortError.exampleIndex());
        assertEquals(1, shortError.messageIndex());

        var longError = report.invalid().get(1).errors().get(0);
        assertEquals(ValidationRule.CONTENT_TOO_LONG, longError.rule());
        assertEquals(2, longError.exampleIndex());
        assertEquals(2, longError.messageIndex());
    }

    @Test
    @DisplayName("Null examples are invalid rather than thrown")
    void nullExample() {
        var input = Arrays.asList(good(), null);

        var report = assertDoesNotThrow(() -> validator.validateBatch(input));

        assertEquals(1, report.valid().size());
        assertEquals(ValidationRule.NULL_EXAMPLE, report.invalid().get(0).errors().get(0).rule());
    }

    @Test
    @DisplayName("Every input lands in exactly one bucket and every rejection carries an error")
    void partition() {
        var input = new ArrayList<TrainingExample>();
        for (int i = 0; i < 20; i++) {
            input.add(i % 3 == 0 ? example(SYSTEM, "short", "also short") : good());
        }

        var report = validator.validateBatch(input);

        assertEquals(input.size(), report.valid().size() + report.invalid().size());
        assertEquals(input.size(), report.total());
        report.invalid().forEach(rejected -> assertFalse(rejected.errors().isEmpty()));
    }

    @Test
    @DisplayName("Null batch yields an empty report")
    void nullBatch() {
        assertEquals(0, validator.validateBatch(null).total());
    }
}
