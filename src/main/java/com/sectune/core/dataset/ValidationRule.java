package com.sectune.core.dataset;

/**
 * Structural rules every training example must satisfy.
 */
public enum ValidationRule {
    NULL_EXAMPLE("example is null"),
    TOO_FEW_MESSAGES("example must contain at least 2 messages"),
    MISSING_SYSTEM_PROMPT("first message must have the system role"),
    CONTENT_TOO_SHORT("message content is too short"),
    CONTENT_TOO_LONG("message content is too long");

    private final String description;

    ValidationRule(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
