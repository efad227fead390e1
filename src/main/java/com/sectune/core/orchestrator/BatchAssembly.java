package com.sectune.core.orchestrator;

import com.sectune.core.dataset.ValidationReport;
import com.sectune.core.model.FineTuningJob;
import com.sectune.core.model.JobStatus;

/**
 * Result of claiming and validating a batch for a job.
 *
 * @param job          the job after assembly (FAILED when the batch was unusable)
 * @param claimedCount records this assembly claimed
 * @param report       validation report for the formatted examples
 */
public record BatchAssembly(
    FineTuningJob job,
    int claimedCount,
    ValidationReport report
) {

    public boolean succeeded() {
        return job.status() != JobStatus.FAILED;
    }
}
