package com.sectune.core.scheduler;

import com.sectune.core.model.FineTuningJob;

/**
 * Outcome of one trigger check.
 *
 * @param outcome         what the check did
 * @param qualifyingCount qualifying unclaimed records seen (0 when skipped)
 * @param threshold       the configured minimum for starting a job
 * @param job             the started job when {@code outcome} is TRIGGERED, else null
 */
public record TriggerResult(
    Outcome outcome,
    int qualifyingCount,
    int threshold,
    FineTuningJob job
) {

    public enum Outcome { BELOW_THRESHOLD, TRIGGERED, SKIPPED_CONCURRENT }

    public static TriggerResult belowThreshold(int count, int threshold) {
        return new TriggerResult(Outcome.BELOW_THRESHOLD, count, threshold, null);
    }

    public static TriggerResult triggered(int count, int threshold, FineTuningJob job) {
        return new TriggerResult(Outcome.TRIGGERED, count, threshold, job);
    }

    public static TriggerResult skipped(int threshold) {
        return new TriggerResult(Outcome.SKIPPED_CONCURRENT, 0, threshold, null);
    }
}
