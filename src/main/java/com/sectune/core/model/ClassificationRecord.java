package com.sectune.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Set;

/**
 * Persisted classification of a conversation.
 * <p>
 * {@code processedForTraining} flips to true once, when a job claims the record,
 * and never reverts. {@code trainingJobId} names the claiming job.
 */
public record ClassificationRecord(
    String conversationId,
    boolean securityRelated,
    double confidence,
    ThreatCategory threatCategory,
    Set<String> matchedKeywords,
    boolean processedForTraining,
    Long trainingJobId,
    Instant classifiedAt
) implements Serializable {

    public ClassificationRecord {
        matchedKeywords = matchedKeywords == null ? Set.of() : Set.copyOf(matchedKeywords);
    }

    /** A fresh, unclaimed record for the given classification. */
    public static ClassificationRecord unclaimed(String conversationId, ClassificationResult result, Instant classifiedAt) {
        return new ClassificationRecord(conversationId, result.securityRelated(), result.confidence(),
                result.threatCategory(), result.matchedKeywords(), false, null, classifiedAt);
    }

    public ClassificationRecord claimedBy(long jobId) {
        return new ClassificationRecord(conversationId, securityRelated, confidence, threatCategory,
                matchedKeywords, true, jobId, classifiedAt);
    }

    /** True when the record may be claimed by a job whose confidence floor is {@code minConfidence}. */
    public boolean qualifies(double minConfidence) {
        return securityRelated && !processedForTraining && confidence >= minConfidence;
    }
}
