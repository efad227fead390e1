package com.sectune.core.orchestrator;

/**
 * Thrown when a fine-tuning job id does not name a stored job.
 */
public class JobNotFoundException extends RuntimeException {

    private final long jobId;

    public JobNotFoundException(long jobId) {
        super("Fine-tuning job not found: " + jobId);
        this.jobId = jobId;
    }

    public long getJobId() {
        return jobId;
    }
}
