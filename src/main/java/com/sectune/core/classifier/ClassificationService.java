package com.sectune.core.classifier;

import com.sectune.core.logging.MdcContext;
import com.sectune.core.metrics.TrainingMetrics;
import com.sectune.core.model.ClassificationRecord;
import com.sectune.core.persistence.TrainingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;

/**
 * Loads a conversation, classifies it and stores the result.
 * Re-classifying a conversation that a job already claimed keeps the claim.
 */
@Service
public class ClassificationService {

    private static final Logger log = LoggerFactory.getLogger(ClassificationService.class);

    private final TrainingStore store;
    private final SecurityClassifier classifier;
    private final TrainingMetrics metrics;

    public ClassificationService(TrainingStore store, SecurityClassifier classifier, TrainingMetrics metrics) {
        this.store = store;
        this.classifier = classifier;
        this.metrics = metrics;
    }

    /**
     * @return the stored record, or empty when the conversation does not exist
     */
    public Optional<ClassificationRecord> classifyConversation(String conversationId) {
        MdcContext.setConversation(conversationId);
        try {
            var conversation = store.findConversation(conversationId);
            if (conversation.isEmpty()) {
                log.warn("Conversation {} not found; nothing to classify", conversationId);
                return Optional.empty();
            }
            var result = classifier.classify(conversation.get());
            store.saveClassification(ClassificationRecord.unclaimed(conversationId, result, Instant.now()));
            metrics.recordClassification(result.securityRelated());
            log.info("Classified conversation {}: securityRelated={} confidence={} category={} keywords={}",
                    conversationId, result.securityRelated(), String.format("%.2f", result.confidence()),
                    result.threatCategory(), result.keywordMatchCount());
            return store.findClassification(conversationId);
        } finally {
            MdcContext.clear();
        }
    }
}
