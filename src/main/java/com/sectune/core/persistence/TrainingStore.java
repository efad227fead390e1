package com.sectune.core.persistence;

import com.sectune.core.model.ClassificationRecord;
import com.sectune.core.model.Conversation;
import com.sectune.core.model.FineTuningJob;
import com.sectune.core.model.JobStatus;
import com.sectune.core.model.PerformanceRecord;
import com.sectune.core.model.TrainingExample;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Storage port for conversations, classifications, jobs, examples and evaluations.
 * <p>
 * Implementations must make {@link #claimBatch}, {@link #compareAndSetJob} and
 * {@link #tryAcquireLease} atomic at the storage layer; callers never perform a
 * read-then-write pair for these operations.
 */
public interface TrainingStore {

    Optional<Conversation> findConversation(String conversationId);

    /**
     * Inserts or refreshes the classification of a conversation. An existing
     * record's {@code processedForTraining} flag and job id are preserved.
     */
    void saveClassification(ClassificationRecord record);

    Optional<ClassificationRecord> findClassification(String conversationId);

    /**
     * Counts security-related, unclaimed records with confidence at or above {@code minConfidence}.
     */
    int countQualifying(double minConfidence);

    /**
     * Atomically claims up to {@code limit} qualifying records for the given job,
     * marking them processed. Returns only the records this call claimed, which
     * may be fewer than requested when another caller claimed first.
     */
    List<ClassificationRecord> claimBatch(long jobId, double minConfidence, int limit);

    /**
     * Returns up to {@code limit} security-related records with confidence at or
     * above {@code minConfidence} that no job has claimed, newest first.
     */
    List<ClassificationRecord> findHeldOut(double minConfidence, int limit);

    /** Persists a new job and returns it with its assigned id. */
    FineTuningJob createJob(FineTuningJob job);

    Optional<FineTuningJob> findJob(long jobId);

    List<FineTuningJob> findJobsByStatus(Set<JobStatus> statuses);

    /**
     * Replaces the stored job with {@code updated} only if its current status is
     * {@code expected}. Status and every accompanying field are written together.
     *
     * @return true if the update was applied
     */
    boolean compareAndSetJob(FineTuningJob updated, JobStatus expected);

    void appendExamples(long jobId, List<TrainingExample> examples);

    List<TrainingExample> findExamples(long jobId);

    void appendPerformance(PerformanceRecord record);

    List<PerformanceRecord> findPerformance(String modelId);

    /**
     * Acquires the named lease for {@code holder} if it is free or expired.
     *
     * @return true if {@code holder} now owns the lease
     */
    boolean tryAcquireLease(String name, String holder, Duration ttl);

    /** Releases the named lease if {@code holder} still owns it. */
    void releaseLease(String name, String holder);
}
