package com.sectune.core.dataset;

/**
 * One rule violation found in a batch.
 *
 * @param exampleIndex position of the offending example in the validated batch
 * @param messageIndex position of the offending message, or null for example-level rules
 * @param rule         the violated rule
 * @param message      human-readable detail
 */
public record ValidationError(
    int exampleIndex,
    Integer messageIndex,
    ValidationRule rule,
    String message
) {

    @Override
    public String toString() {
        return messageIndex == null
                ? "example %d: %s".formatted(exampleIndex, message)
                : "example %d, message %d: %s".formatted(exampleIndex, messageIndex, message);
    }
}
