package com.sectune.core.orchestrator;

import com.sectune.core.dataset.TrainingExampleFormatter;
import com.sectune.core.dataset.TrainingExampleValidator;
import com.sectune.core.dataset.ValidationReport;
import com.sectune.core.evaluation.EvaluationProperties;
import com.sectune.core.evaluation.PerformanceEvaluator;
import com.sectune.core.logging.MdcContext;
import com.sectune.core.metrics.TrainingMetrics;
import com.sectune.core.model.ClassificationRecord;
import com.sectune.core.model.ClassificationResult;
import com.sectune.core.model.FineTuningJob;
import com.sectune.core.model.JobStatus;
import com.sectune.core.model.TrainingExample;
import com.sectune.core.persistence.TrainingStore;
import com.sectune.core.persistence.TrainingStoreException;
import com.sectune.provider.FineTuningProvider;
import com.sectune.provider.ProviderJobStatus;
import com.sectune.provider.ProviderTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Drives fine-tuning jobs through their lifecycle.
 * <p>
 * A job is created in PREPARING, claims and validates a batch of classified
 * conversations, is submitted to the {@link FineTuningProvider}, and is then
 * polled until the provider reports a terminal outcome. Every status change goes
 * through {@link TrainingStore#compareAndSetJob}, so a transition computed from a
 * stale copy of the job is discarded instead of overwriting a newer one.
 */
@Service
public class JobOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(JobOrchestrator.class);

    private static final DateTimeFormatter JOB_NAME_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);

    static final String SUBMIT_LEASE_PREFIX = "job-submit-";

    static final Set<JobStatus> ACTIVE_STATUSES = Set.of(JobStatus.DATA_UPLOADED, JobStatus.TRAINING);

    private final TrainingStore store;
    private final TrainingExampleFormatter formatter;
    private final TrainingExampleValidator validator;
    private final FineTuningProvider provider;
    private final PerformanceEvaluator evaluator;
    private final TrainingProperties properties;
    private final EvaluationProperties evaluationProperties;
    private final TrainingMetrics metrics;

    public JobOrchestrator(TrainingStore store, TrainingExampleFormatter formatter,
                           TrainingExampleValidator validator, FineTuningProvider provider,
                           PerformanceEvaluator evaluator, TrainingProperties properties,
                           EvaluationProperties evaluationProperties, TrainingMetrics metrics) {
        this.store = store;
        this.formatter = formatter;
        this.validator = validator;
        this.provider = provider;
        this.evaluator = evaluator;
        this.properties = properties;
        this.evaluationProperties = evaluationProperties;
        this.metrics = metrics;
    }

    /**
     * Creates a PREPARING job for the configured model type and base model.
     */
    public FineTuningJob createJob() {
        return createJob(properties.getModelType(), properties.getBaseModel());
    }

    public FineTuningJob createJob(String modelType, String baseModel) {
        Instant now = Instant.now();
        var job = store.createJob(FineTuningJob.preparing(
                "security-ft-" + JOB_NAME_FORMAT.format(now), modelType, baseModel,
                properties.toHyperparameters(), now));
        metrics.recordJobTransition(JobStatus.PREPARING.name());
        log.info("Created fine-tuning job {} ({}) for base model {}", job.id(), job.jobName(), baseModel);
        return job;
    }

    /**
     * Claims up to {@code batchLimit} qualifying records for the job, formats and
     * validates them, and attaches the valid examples. The job is failed when fewer
     * than {@code minimumValidExamples} survive validation. Claimed records stay
     * claimed either way.
     */
    public BatchAssembly assembleBatch(FineTuningJob job) {
        var current = requireStatus(reload(job.id()), JobStatus.PREPARING);
        MdcContext.setJob(current.id());
        try {
            List<ClassificationRecord> claimed;
            try {
                claimed = store.claimBatch(current.id(), properties.getTriggerConfidenceThreshold(),
                        properties.getBatchLimit());
            } catch (TrainingStoreException e) {
                log.error("Failed to claim a training batch for job {}", current.id(), e);
                return new BatchAssembly(fail(current, "Failed to claim training batch: " + e.getMessage()),
                        0, emptyReport());
            }
            metrics.recordClaimed(claimed.size());
            log.info("Job {} claimed {} classification records", current.id(), claimed.size());

            var examples = new ArrayList<TrainingExample>();
            for (var record : claimed) {
                var conversation = store.findConversation(record.conversationId());
                if (conversation.isEmpty()) {
                    log.warn("Claimed conversation {} no longer exists; skipping", record.conversationId());
                    continue;
                }
                examples.add(formatter.format(conversation.get(), toResult(record)));
            }

            ValidationReport report = validator.validateBatch(examples);
            metrics.recordValidation(report.valid().size(), report.invalid().size());
            if (!report.invalid().isEmpty()) {
                log.info("Job {}: {} of {} examples rejected by validation",
                        current.id(), report.invalid().size(), report.total());
            }

            if (report.valid().size() < properties.getMinimumValidExamples()) {
                var failed = fail(current, "Insufficient training data: %d valid examples from %d claimed conversations (minimum %d)"
                        .formatted(report.valid().size(), claimed.size(), properties.getMinimumValidExamples()));
                return new BatchAssembly(failed, claimed.size(), report);
            }

            try {
                store.appendExamples(current.id(), report.valid());
            } catch (TrainingStoreException e) {
                log.error("Failed to store training examples for job {}", current.id(), e);
                return new BatchAssembly(fail(current, "Failed to store training examples: " + e.getMessage()),
                        claimed.size(), report);
            }
            return new BatchAssembly(current, claimed.size(), report);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Uploads the job's examples to the provider and moves it to DATA_UPLOADED.
     * A provider error fails the job. The job's submit lease is held across the
     * provider call, so a concurrent submit of the same job is rejected instead
     * of creating a second provider job.
     */
    public FineTuningJob submit(FineTuningJob job) {
        requireStatus(reload(job.id()), JobStatus.PREPARING);
        String lease = SUBMIT_LEASE_PREFIX + job.id();
        String holder = UUID.randomUUID().toString();
        if (!store.tryAcquireLease(lease, holder, Duration.ofMinutes(properties.getLeaseTtlMinutes()))) {
            throw new IllegalStateException("Job %d is already being submitted".formatted(job.id()));
        }
        MdcContext.setJob(job.id());
        try {
            var current = requireStatus(reload(job.id()), JobStatus.PREPARING);
            var examples = store.findExamples(current.id());
            if (examples.isEmpty()) {
                return fail(current, "No training examples attached to job");
            }
            String providerJobId;
            try {
                providerJobId = provider.submit(current.jobName() + ".jsonl", examples,
                        current.baseModel(), current.hyperparameters());
            } catch (RuntimeException e) {
                log.error("Provider submission failed for job {}", current.id(), e);
                return fail(current, "Submission to " + provider.name() + " failed: " + e.getMessage());
            }
            log.info("Job {} submitted to {} as {} with {} examples",
                    current.id(), provider.name(), providerJobId, examples.size());
            return transition(current, current.uploaded(providerJobId, examples.size(), Instant.now()));
        } finally {
            store.releaseLease(lease, holder);
            MdcContext.clear();
        }
    }

    /**
     * Polls the provider once and applies the reported state to the job.
     * Terminal jobs are returned unchanged. A poll timeout leaves the job as it
     * was; any other poll error fails it.
     */
    public FineTuningJob pollStatus(FineTuningJob job) {
        var current = reload(job.id());
        if (current.status().isTerminal() || current.providerJobId() == null) {
            return current;
        }
        MdcContext.setJob(current.id());
        try {
            ProviderJobStatus status;
            try {
                status = provider.status(current.providerJobId());
            } catch (ProviderTimeoutException e) {
                log.warn("Status poll for job {} timed out; will retry on next poll", current.id());
                metrics.recordPollTimeout();
                return current;
            } catch (RuntimeException e) {
                log.error("Status poll failed for job {}", current.id(), e);
                return fail(current, "Status poll failed: " + e.getMessage());
            }

            return switch (status.state()) {
                case RUNNING -> current.status() == JobStatus.TRAINING
                        ? current
                        : transition(current, current.training(Instant.now()));
                case SUCCEEDED -> complete(current, status);
                case FAILED -> fail(current, status.error() != null ? status.error() : "Provider job failed");
                case CANCELLED -> fail(current, status.error() != null
                        ? "Provider job cancelled: " + status.error()
                        : "Provider job cancelled");
                case QUEUED, UNKNOWN -> {
                    log.debug("Job {} provider state {} ({}); no change", current.id(), status.state(), status.rawState());
                    yield current;
                }
            };
        } finally {
            MdcContext.clear();
        }
    }

    public FineTuningJob pollStatus(long jobId) {
        return pollStatus(reload(jobId));
    }

    /**
     * Polls every DATA_UPLOADED or TRAINING job. A failure on one job is logged
     * and does not stop the sweep.
     */
    public List<FineTuningJob> pollActiveJobs() {
        var results = new ArrayList<FineTuningJob>();
        for (var job : store.findJobsByStatus(ACTIVE_STATUSES)) {
            try {
                results.add(pollStatus(job));
            } catch (RuntimeException e) {
                log.error("Unexpected error polling job {}", job.id(), e);
                results.add(job);
            }
        }
        return results;
    }

    public Optional<FineTuningJob> findJob(long jobId) {
        return store.findJob(jobId);
    }

    public List<FineTuningJob> findJobs(Set<JobStatus> statuses) {
        return store.findJobsByStatus(statuses);
    }

    private FineTuningJob complete(FineTuningJob current, ProviderJobStatus status) {
        if (status.fineTunedModel() == null) {
            log.warn("Provider reported success for job {} without a fine-tuned model id; will retry", current.id());
            return current;
        }
        var completed = current.completed(status.fineTunedModel(), Instant.now());
        if (!tryTransition(current, completed)) {
            return reload(current.id());
        }
        if (evaluationProperties.isAutoEvaluate()) {
            try {
                evaluator.evaluate(completed.fineTunedModelId());
            } catch (RuntimeException e) {
                log.warn("Automatic evaluation of {} failed: {}", completed.fineTunedModelId(), e.getMessage());
            } finally {
                MdcContext.setJob(completed.id());
            }
        }
        return completed;
    }

    private FineTuningJob fail(FineTuningJob current, String message) {
        log.warn("Job {} failed: {}", current.id(), message);
        return transition(current, current.failed(message, Instant.now()));
    }

    /**
     * Applies {@code next} only if the stored job is still in {@code current}'s
     * status. When another writer got there first, the stored job is returned.
     */
    private FineTuningJob transition(FineTuningJob current, FineTuningJob next) {
        return tryTransition(current, next) ? next : reload(current.id());
    }

    /**
     * @return true if this call's update was applied, false if another writer won
     */
    private boolean tryTransition(FineTuningJob current, FineTuningJob next) {
        if (!current.status().canTransitionTo(next.status())) {
            throw new IllegalStateException("Illegal job transition %s -> %s for job %d"
                    .formatted(current.status(), next.status(), current.id()));
        }
        if (store.compareAndSetJob(next, current.status())) {
            metrics.recordJobTransition(next.status().name());
            log.info("Job {} {} -> {}", current.id(), current.status(), next.status());
            return true;
        }
        log.warn("Job {} changed concurrently; discarding {} -> {}", current.id(), current.status(), next.status());
        return false;
    }

    private FineTuningJob reload(long jobId) {
        return store.findJob(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    private static FineTuningJob requireStatus(FineTuningJob job, JobStatus expected) {
        if (job.status() != expected) {
            throw new IllegalStateException("Job %d is %s, expected %s".formatted(job.id(), job.status(), expected));
        }
        return job;
    }

    private static ClassificationResult toResult(ClassificationRecord record) {
        return new ClassificationResult(record.securityRelated(), record.confidence(),
                record.threatCategory(), record.matchedKeywords());
    }

    private static ValidationReport emptyReport() {
        return new ValidationReport(List.of(), List.of(), List.of());
    }
}
