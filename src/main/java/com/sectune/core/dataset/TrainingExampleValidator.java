package com.sectune.core.dataset;

import com.sectune.core.model.ChatMessage;
import com.sectune.core.model.MessageRole;
import com.sectune.core.model.TrainingExample;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks training examples against the provider's structural constraints.
 * <p>
 * Validation never throws: malformed input, including null examples and null
 * message content, is reported as invalid.
 */
@Component
public class TrainingExampleValidator {

    public static final int MIN_MESSAGES = 2;
    public static final int MIN_CONTENT_LENGTH = 10;
    /** Exclusive upper bound on message content length. */
    public static final int MAX_CONTENT_LENGTH = 4000;

    public ValidationReport validateBatch(List<TrainingExample> examples) {
        var valid = new ArrayList<TrainingExample>();
        var invalid = new ArrayList<ValidationReport.RejectedExample>();
        var errors = new ArrayList<ValidationError>();

        if (examples == null) {
            return new ValidationReport(List.of(), List.of(), List.of());
        }

        for (int i = 0; i < examples.size(); i++) {
            TrainingExample example = examples.get(i);
            List<ValidationError> exampleErrors = validate(i, example);
            if (exampleErrors.isEmpty()) {
                valid.add(example);
            } else {
                invalid.add(new ValidationReport.RejectedExample(i, example, List.copyOf(exampleErrors)));
                errors.addAll(exampleErrors);
            }
        }
        return new ValidationReport(List.copyOf(valid), List.copyOf(invalid), List.copyOf(errors));
    }

    List<ValidationError> validate(int index, TrainingExample example) {
        var errors = new ArrayList<ValidationError>();
        if (example == null) {
            errors.add(new ValidationError(index, null, ValidationRule.NULL_EXAMPLE,
                    ValidationRule.NULL_EXAMPLE.description()));
            return errors;
        }

        List<ChatMessage> messages = example.messages();
        if (messages.size() < MIN_MESSAGES) {
            errors.add(new ValidationError(index, null, ValidationRule.TOO_FEW_MESSAGES,
                    "%s (found %d)".formatted(ValidationRule.TOO_FEW_MESSAGES.description(), messages.size())));
        }
        if (messages.isEmpty() || messages.get(0).role() != MessageRole.SYSTEM) {
            errors.add(new ValidationError(index, null, ValidationRule.MISSING_SYSTEM_PROMPT,
                    ValidationRule.MISSING_SYSTEM_PROMPT.description()));
        }

        for (int m = 0; m < messages.size(); m++) {
            String content = messages.get(m).content();
            int length = content == null ? 0 : content.length();
            if (length < MIN_CONTENT_LENGTH) {
                errors.add(new ValidationError(index, m, ValidationRule.CONTENT_TOO_SHORT,
                        "%s (%d chars, minimum %d)".formatted(
                                ValidationRule.CONTENT_TOO_SHORT.description(), length, MIN_CONTENT_LENGTH)));
            } else if (length >= MAX_CONTENT_LENGTH) {
                errors.add(new ValidationError(index, m, ValidationRule.CONTENT_TOO_LONG,
                        "%s (%d chars, limit %d)".formatted(
                                ValidationRule.CONTENT_TOO_LONG.description(), length, MAX_CONTENT_LENGTH)));
            }
        }
        return errors;
    }
}
