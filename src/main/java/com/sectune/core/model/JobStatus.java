package com.sectune.core.model;

/**
 * Lifecycle status of a fine-tuning job.
 * <p>
 * Statuses only move forward in declaration order; {@link #FAILED} is reachable
 * from every non-terminal status. {@link #COMPLETED} and {@link #FAILED} are terminal.
 */
public enum JobStatus {
    PREPARING,
    DATA_UPLOADED,
    TRAINING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(JobStatus target) {
        if (target == null || isTerminal()) {
            return false;
        }
        if (target == FAILED) {
            return true;
        }
        return target.ordinal() > ordinal();
    }
}
