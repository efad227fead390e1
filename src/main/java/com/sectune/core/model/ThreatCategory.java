package com.sectune.core.model;

import java.util.Optional;

/**
 * Threat categories a security conversation can be assigned to.
 */
public enum ThreatCategory {
    MALWARE("malware", "malware"),
    PHISHING("phishing", "phishing"),
    NETWORK_INTRUSION("network_intrusion", "network intrusion"),
    VULNERABILITY("vulnerability", "vulnerability"),
    DATA_BREACH("data_breach", "data breach"),
    SOCIAL_ENGINEERING("social_engineering", "social engineering");

    private final String label;
    private final String displayName;

    ThreatCategory(String label, String displayName) {
        this.label = label;
        this.displayName = displayName;
    }

    /** Stable identifier used in storage, payloads and model answers. */
    public String label() {
        return label;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Resolves a label such as {@code "network_intrusion"} or {@code "Network Intrusion"}.
     * Hyphens and spaces are treated as underscores.
     */
    public static Optional<ThreatCategory> fromLabel(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = normalize(value);
        for (ThreatCategory category : values()) {
            if (category.label.equals(normalized)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    static String normalize(String value) {
        return value.trim().toLowerCase().replaceAll("[\\s-]+", "_");
    }
}
