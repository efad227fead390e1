package com.sectune.core.scheduler;

import com.sectune.core.metrics.TrainingMetrics;
import com.sectune.core.orchestrator.JobOrchestrator;
import com.sectune.core.orchestrator.TrainingProperties;
import com.sectune.core.persistence.TrainingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.UUID;

/**
 * Starts a fine-tuning job once enough qualifying classified conversations have
 * accumulated.
 * <p>
 * Invoked externally (REST, CLI or a cron). Concurrent invocations are
 * serialized through the store's {@value #LEASE_NAME} lease; a check that finds
 * the lease held returns immediately without counting.
 */
@Service
public class TriggerScheduler {

    private static final Logger log = LoggerFactory.getLogger(TriggerScheduler.class);

    static final String LEASE_NAME = "training-trigger";

    private final TrainingStore store;
    private final JobOrchestrator orchestrator;
    private final TrainingProperties properties;
    private final TrainingMetrics metrics;

    public TriggerScheduler(TrainingStore store, JobOrchestrator orchestrator,
                            TrainingProperties properties, TrainingMetrics metrics) {
        this.store = store;
        this.orchestrator = orchestrator;
        this.properties = properties;
        this.metrics = metrics;
    }

    public TriggerResult checkAndTrigger() {
        int threshold = properties.getMinimumJobThreshold();
        String holder = UUID.randomUUID().toString();
        if (!store.tryAcquireLease(LEASE_NAME, holder, Duration.ofMinutes(properties.getLeaseTtlMinutes()))) {
            log.info("Another trigger check holds the '{}' lease; skipping", LEASE_NAME);
            metrics.recordTrigger(TriggerResult.Outcome.SKIPPED_CONCURRENT.name(), 0);
            return TriggerResult.skipped(threshold);
        }
        try {
            int count = store.countQualifying(properties.getTriggerConfidenceThreshold());
            if (count < threshold) {
                log.info("{} qualifying conversations, below threshold {}", count, threshold);
                metrics.recordTrigger(TriggerResult.Outcome.BELOW_THRESHOLD.name(), count);
                return TriggerResult.belowThreshold(count, threshold);
            }

            log.info("{} qualifying conversations reached threshold {}; starting fine-tuning job", count, threshold);
            var job = orchestrator.createJob();
            var assembly = orchestrator.assembleBatch(job);
            var result = assembly.succeeded() ? orchestrator.submit(assembly.job()) : assembly.job();
            metrics.recordTrigger(TriggerResult.Outcome.TRIGGERED.name(), count);
            return TriggerResult.triggered(count, threshold, result);
        } finally {
            store.releaseLease(LEASE_NAME, holder);
        }
    }
}
