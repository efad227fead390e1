package com.sectune.core.dataset;

import com.sectune.core.model.TrainingExample;

import java.util.List;

/**
 * Outcome of validating a batch of training examples.
 * Every input example lands in exactly one of {@code valid} or {@code invalid}.
 */
public record ValidationReport(
    List<TrainingExample> valid,
    List<RejectedExample> invalid,
    List<ValidationError> errors
) {

    /**
     * An example that failed validation, with the errors attributed to it.
     */
    public record RejectedExample(int index, TrainingExample example, List<ValidationError> errors) {}

    public int total() {
        return valid.size() + invalid.size();
    }
}
