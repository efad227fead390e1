package com.sectune.core.evaluation;

import com.sectune.core.model.ThreatCategory;
import org.springframework.stereotype.Component;

/**
 * Exact category match: the normalized answer must equal the expected label,
 * or {@code none} when no category was recorded.
 */
@Component
public class CategoryMatchComparator implements PredictionComparator {

    static final String NO_CATEGORY = "none";

    @Override
    public boolean matches(ThreatCategory expected, String modelOutput) {
        if (modelOutput == null || modelOutput.isBlank()) {
            return false;
        }
        String expectedLabel = expected == null ? NO_CATEGORY : expected.label();
        return normalize(modelOutput).equals(expectedLabel);
    }

    static String normalize(String output) {
        return output.trim()
                .toLowerCase()
                .replaceAll("[\\s-]+", "_")
                .replaceAll("^[^a-z_]+|[^a-z_]+$", "")
                .replaceAll("^_+|_+$", "");
    }
}
