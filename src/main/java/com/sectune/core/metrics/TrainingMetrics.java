package com.sectune.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Service;

/**
 * Centralised Micrometer metrics for classification and fine-tuning.
 */
@Service
public class TrainingMetrics {

    private final MeterRegistry registry;

    public TrainingMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordClassification(boolean securityRelated) {
        Counter.builder("sectune.classifications.total")
                .tag("security_related", String.valueOf(securityRelated))
                .register(registry)
                .increment();
    }

    /**
     * Records the outcome of one batch validation.
     *
     * @param valid   examples that passed every rule
     * @param invalid examples rejected by at least one rule
     */
    public void recordValidation(int valid, int invalid) {
        Counter.builder("sectune.examples.validated")
                .tag("result", "valid")
                .register(registry)
                .increment(valid);
        Counter.builder("sectune.examples.validated")
                .tag("result", "invalid")
                .register(registry)
                .increment(invalid);
    }

    public void recordTrigger(String outcome, int qualifyingCount) {
        Counter.builder("sectune.trigger.checks")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
        DistributionSummary.builder("sectune.trigger.qualifying_count")
                .description("Qualifying unclaimed records seen by each trigger check")
                .register(registry)
                .record(qualifyingCount);
    }

    public void recordClaimed(int count) {
        DistributionSummary.builder("sectune.batch.claimed")
                .description("Classification records claimed per batch")
                .register(registry)
                .record(count);
    }

    public void recordJobTransition(String status) {
        Counter.builder("sectune.jobs.transitions")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordPollTimeout() {
        Counter.builder("sectune.jobs.poll_timeouts")
                .description("Provider status polls that timed out")
                .register(registry)
                .increment();
    }

    public void recordEvaluationScore(double score) {
        DistributionSummary.builder("sectune.evaluation.score")
                .register(registry)
                .record(score);
    }
}
