package com.sectune.core.classifier;

import com.sectune.core.model.ChatMessage;
import com.sectune.core.model.ClassificationResult;
import com.sectune.core.model.Conversation;
import com.sectune.core.model.ThreatCategory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Decides whether a conversation is security-relevant, which threat category it
 * belongs to and how confident that decision is.
 * <p>
 * Matching is case-insensitive substring containment over the fixed tables in
 * {@link SecurityVocabulary}. The classifier holds no mutable state, so identical
 * input always yields an identical result.
 */
@Component
public class SecurityClassifier {

    private final int minimumMessages;
    private final int minimumKeywordMatches;
    private final double relevanceThreshold;

    @Autowired
    public SecurityClassifier(ClassifierProperties properties) {
        this(properties.getMinimumMessages(), properties.getMinimumKeywordMatches(),
                properties.getRelevanceThreshold());
    }

    public SecurityClassifier(int minimumMessages, int minimumKeywordMatches, double relevanceThreshold) {
        this.minimumMessages = minimumMessages;
        this.minimumKeywordMatches = minimumKeywordMatches;
        this.relevanceThreshold = relevanceThreshold;
    }

    /**
     * Classifies a conversation.
     *
     * @param conversation the conversation to inspect
     * @return the classification; conversations shorter than the minimum message
     *         count are never relevant and carry zero confidence
     */
    public ClassificationResult classify(Conversation conversation) {
        if (conversation == null || conversation.messageCount() < minimumMessages) {
            return ClassificationResult.insufficient();
        }

        String text = conversation.messages().stream()
                .map(ChatMessage::content)
                .filter(Objects::nonNull)
                .collect(Collectors.joining(" "))
                .toLowerCase();

        Set<String> matched = matchKeywords(text);
        ThreatCategory category = assignCategory(text);

        double confidence = Math.min((double) matched.size() / conversation.messageCount() * 2, 1.0);
        boolean relevant = matched.size() >= minimumKeywordMatches && confidence > relevanceThreshold;

        return new ClassificationResult(relevant, confidence, category, matched);
    }

    static Set<String> matchKeywords(String lowerText) {
        var matched = new TreeSet<String>();
        for (String keyword : SecurityVocabulary.KEYWORDS) {
            if (lowerText.contains(keyword)) {
                matched.add(keyword);
            }
        }
        return matched;
    }

    /**
     * Picks the category with strictly more distinct pattern hits than any other.
     * A tie for the top count, or no hits at all, yields null.
     */
    static ThreatCategory assignCategory(String lowerText) {
        ThreatCategory best = null;
        int bestCount = 0;
        boolean tied = false;

        for (Map.Entry<ThreatCategory, List<String>> entry : SecurityVocabulary.CATEGORY_PATTERNS.entrySet()) {
            int count = 0;
            for (String pattern : entry.getValue()) {
                if (lowerText.contains(pattern)) {
                    count++;
                }
            }
            if (count == 0) {
                continue;
            }
            if (count > bestCount) {
                best = entry.getKey();
                bestCount = count;
                tied = false;
            } else if (count == bestCount) {
                tied = true;
            }
        }
        return tied ? null : best;
    }
}
