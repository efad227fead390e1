package com.sectune.core.evaluation;

import com.sectune.core.logging.MdcContext;
import com.sectune.core.metrics.TrainingMetrics;
import com.sectune.core.model.ChatMessage;
import com.sectune.core.model.ClassificationRecord;
import com.sectune.core.model.MessageRole;
import com.sectune.core.model.PerformanceRecord;
import com.sectune.core.model.ThreatCategory;
import com.sectune.core.persistence.TrainingStore;
import com.sectune.provider.FineTuningProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Scores a fine-tuned model on a held-out sample of high-confidence
 * classifications and appends the result to the model's performance history.
 * <p>
 * Each sampled conversation's user content is sent to the model, which is asked
 * to name the threat category. The score is the fraction of answers accepted by
 * the configured {@link PredictionComparator}. A failed invocation counts as an
 * incorrect answer.
 */
@Service
public class PerformanceEvaluator {

    private static final Logger log = LoggerFactory.getLogger(PerformanceEvaluator.class);

    static final String EVALUATION_TYPE = "accuracy";

    static final String EVALUATION_PROMPT = "You are a cybersecurity analyst. "
            + "Identify the threat category of the following conversation. Answer with exactly one of: "
            + Arrays.stream(ThreatCategory.values()).map(ThreatCategory::label).collect(Collectors.joining(", "))
            + ", " + CategoryMatchComparator.NO_CATEGORY + ".";

    private final TrainingStore store;
    private final FineTuningProvider provider;
    private final PredictionComparator comparator;
    private final EvaluationProperties properties;
    private final TrainingMetrics metrics;

    public PerformanceEvaluator(TrainingStore store, FineTuningProvider provider,
                                PredictionComparator comparator, EvaluationProperties properties,
                                TrainingMetrics metrics) {
        this.store = store;
        this.provider = provider;
        this.comparator = comparator;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * Evaluates {@code modelId} against the held-out sample.
     *
     * @return the appended record, or empty when the sample held nothing to evaluate
     */
    public Optional<PerformanceRecord> evaluate(String modelId) {
        if (modelId == null || modelId.isBlank()) {
            throw new IllegalArgumentException("Model id must not be blank");
        }
        MdcContext.setModel(modelId);
        try {
            var sample = store.findHeldOut(properties.getMinConfidence(), properties.getSampleSize());
            int evaluated = 0;
            int correct = 0;
            for (ClassificationRecord record : sample) {
                var userContent = store.findConversation(record.conversationId())
                        .map(c -> c.joinedContent(MessageRole.USER))
                        .orElse(null);
                if (userContent == null) {
                    log.debug("Skipping held-out conversation {} with no user content", record.conversationId());
                    continue;
                }
                evaluated++;
                if (answeredCorrectly(modelId, record, userContent)) {
                    correct++;
                }
            }

            if (evaluated == 0) {
                log.info("No held-out conversations available to evaluate model {}", modelId);
                return Optional.empty();
            }

            double score = (double) correct / evaluated;
            var result = new PerformanceRecord(modelId, EVALUATION_TYPE, score, evaluated, Instant.now());
            store.appendPerformance(result);
            metrics.recordEvaluationScore(score);
            log.info("Model {} scored {} ({}/{} correct)", modelId, String.format("%.3f", score), correct, evaluated);
            return Optional.of(result);
        } finally {
            MdcContext.clear();
        }
    }

    public List<PerformanceRecord> history(String modelId) {
        return store.findPerformance(modelId);
    }

    private boolean answeredCorrectly(String modelId, ClassificationRecord record, String userContent) {
        try {
            String answer = provider.complete(modelId, List.of(
                    ChatMessage.system(EVALUATION_PROMPT),
                    ChatMessage.user(userContent)));
            return comparator.matches(record.threatCategory(), answer);
        } catch (RuntimeException e) {
            log.warn("Model {} failed on conversation {}: {}", modelId, record.conversationId(), e.getMessage());
            return false;
        }
    }
}
