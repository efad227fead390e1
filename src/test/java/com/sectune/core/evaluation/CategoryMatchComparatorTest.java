package com.sectune.core.evaluation;

import com.sectune.core.model.ThreatCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CategoryMatchComparatorTest {

    private final CategoryMatchComparator comparator = new CategoryMatchComparator();

    @Test
    @DisplayName("Matches the exact label")
    void exactLabel() {
        assertTrue(comparator.matches(ThreatCategory.MALWARE, "malware"));
    }

    @Test
    @DisplayName("Ignores case, surrounding whitespace, quotes and punctuation")
    void normalizesAnswer() {
        assertTrue(comparator.matches(ThreatCategory.NETWORK_INTRUSION, "  Network Intrusion.\n"));
        assertTrue(comparator.matches(ThreatCategory.DATA_BREACH, "\"data-breach\""));
    }

    @Test
    @DisplayName("Absent category expects none")
    void absentCategory() {
        assertTrue(comparator.matches(null, "None"));
        assertFalse(comparator.matches(null, "malware"));
    }

    @Test
    @DisplayName("Different or wordy answers do not match")
    void mismatch() {
        assertFalse(comparator.matches(ThreatCategory.MALWARE, "phishing"));
        assertFalse(comparator.matches(ThreatCategory.MALWARE, "I think it is malware"));
        assertFalse(comparator.matches(ThreatCategory.MALWARE, null));
        assertFalse(comparator.matches(ThreatCategory.MALWARE, "  "));
    }
}
