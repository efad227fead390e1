package com.sectune.core.evaluation;

import com.sectune.core.model.ThreatCategory;

/**
 * Decides whether a model's answer matches the recorded threat category.
 */
@FunctionalInterface
public interface PredictionComparator {

    /**
     * @param expected    recorded category, or null when none was assigned
     * @param modelOutput raw completion text returned by the model
     */
    boolean matches(ThreatCategory expected, String modelOutput);
}
