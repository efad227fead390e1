package com.sectune.core.persistence;

import com.sectune.core.model.ClassificationRecord;
import com.sectune.core.model.Conversation;
import com.sectune.core.model.FineTuningJob;
import com.sectune.core.model.JobStatus;
import com.sectune.core.model.PerformanceRecord;
import com.sectune.core.model.TrainingExample;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link TrainingStore} held in process memory.
 * <p>
 * Suitable for development and tests; nothing survives a restart. The claim,
 * job compare-and-set and lease operations each run under the store's monitor,
 * which gives them the same all-or-nothing behaviour as the JDBC store's
 * conditional updates.
 */
public class InMemoryTrainingStore implements TrainingStore {

    private final Map<String, Conversation> conversations = new ConcurrentHashMap<>();
    private final Map<String, ClassificationRecord> classifications = new LinkedHashMap<>();
    private final Map<Long, FineTuningJob> jobs = new ConcurrentHashMap<>();
    private final Map<Long, List<TrainingExample>> examples = new ConcurrentHashMap<>();
    private final List<PerformanceRecord> performance = new CopyOnWriteArrayList<>();
    private final Map<String, Lease> leases = new LinkedHashMap<>();
    private final AtomicLong jobIds = new AtomicLong();
    private final Clock clock;

    private record Lease(String holder, Instant expiresAt) {}

    public InMemoryTrainingStore() {
        this(Clock.systemUTC());
    }

    public InMemoryTrainingStore(Clock clock) {
        this.clock = clock;
    }

    /** Registers a conversation, standing in for the chat system's ingestion. */
    public void putConversation(Conversation conversation) {
        conversations.put(conversation.id(), conversation);
    }

    @Override
    public Optional<Conversation> findConversation(String conversationId) {
        return Optional.ofNullable(conversations.get(conversationId));
    }

    @Override
    public synchronized void saveClassification(ClassificationRecord record) {
        var existing = classifications.get(record.conversationId());
        if (existing != null && existing.processedForTraining()) {
            record = record.claimedBy(existing.trainingJobId());
        }
        classifications.put(record.conversationId(), record);
    }

    @Override
    public synchronized Optional<ClassificationRecord> findClassification(String conversationId) {
        return Optional.ofNullable(classifications.get(conversationId));
    }

    @Override
    public synchronized int countQualifying(double minConfidence) {
        return (int) classifications.values().stream()
                .filter(r -> r.qualifies(minConfidence))
                .count();
    }

    @Override
    public synchronized List<ClassificationRecord> claimBatch(long jobId, double minConfidence, int limit) {
        var claimed = new ArrayList<ClassificationRecord>();
        var candidates = classifications.values().stream()
                .filter(r -> r.qualifies(minConfidence))
                .sorted(Comparator.comparing(ClassificationRecord::classifiedAt)
                        .thenComparing(ClassificationRecord::conversationId))
                .limit(Math.max(limit, 0))
                .toList();
        for (var record : candidates) {
            var updated = record.claimedBy(jobId);
            classifications.put(updated.conversationId(), updated);
            claimed.add(updated);
        }
        return claimed;
    }

    @Override
    public synchronized List<ClassificationRecord> findHeldOut(double minConfidence, int limit) {
        return classifications.values().stream()
                .filter(r -> r.securityRelated() && !r.processedForTraining() && r.confidence() >= minConfidence)
                .sorted(Comparator.comparing(ClassificationRecord::classifiedAt).reversed()
                        .thenComparing(ClassificationRecord::conversationId))
                .limit(Math.max(limit, 0))
                .toList();
    }

    @Override
    public FineTuningJob createJob(FineTuningJob job) {
        var created = job.withId(jobIds.incrementAndGet());
        jobs.put(created.id(), created);
        return created;
    }

    @Override
    public Optional<FineTuningJob> findJob(long jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public List<FineTuningJob> findJobsByStatus(Set<JobStatus> statuses) {
        return jobs.values().stream()
                .filter(j -> statuses.contains(j.status()))
                .sorted(Comparator.comparing(FineTuningJob::id))
                .toList();
    }

    @Override
    public synchronized boolean compareAndSetJob(FineTuningJob updated, JobStatus expected) {
        var current = jobs.get(updated.id());
        if (current == null || current.status() != expected) {
            return false;
        }
        jobs.put(updated.id(), updated);
        return true;
    }

    @Override
    public void appendExamples(long jobId, List<TrainingExample> batch) {
        examples.computeIfAbsent(jobId, k -> new CopyOnWriteArrayList<>()).addAll(batch);
    }

    @Override
    public List<TrainingExample> findExamples(long jobId) {
        return List.copyOf(examples.getOrDefault(jobId, List.of()));
    }

    @Override
    public void appendPerformance(PerformanceRecord record) {
        performance.add(record);
    }

    @Override
    public List<PerformanceRecord> findPerformance(String modelId) {
        return performance.stream()
                .filter(r -> r.modelId().equals(modelId))
                .sorted(Comparator.comparing(PerformanceRecord::evaluationDate))
                .toList();
    }

    @Override
    public synchronized boolean tryAcquireLease(String name, String holder, Duration ttl) {
        Instant now = clock.instant();
        var current = leases.get(name);
        if (current != null && current.expiresAt().isAfter(now) && !current.holder().equals(holder)) {
            return false;
        }
        leases.put(name, new Lease(holder, now.plus(ttl)));
        return true;
    }

    @Override
    public synchronized void releaseLease(String name, String holder) {
        var current = leases.get(name);
        if (current != null && current.holder().equals(holder)) {
            leases.remove(name);
        }
    }
}
