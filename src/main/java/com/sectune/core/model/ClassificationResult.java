package com.sectune.core.model;

import java.io.Serializable;
import java.util.Set;

/**
 * Output of classifying one conversation.
 *
 * @param securityRelated  whether the conversation qualifies as security-relevant
 * @param confidence       keyword-density confidence in [0, 1]
 * @param threatCategory   assigned category, or null when none wins outright
 * @param matchedKeywords  vocabulary terms found at least once
 */
public record ClassificationResult(
    boolean securityRelated,
    double confidence,
    ThreatCategory threatCategory,
    Set<String> matchedKeywords
) implements Serializable {

    public ClassificationResult {
        matchedKeywords = matchedKeywords == null ? Set.of() : Set.copyOf(matchedKeywords);
    }

    public static ClassificationResult insufficient() {
        return new ClassificationResult(false, 0.0, null, Set.of());
    }

    public int keywordMatchCount() {
        return matchedKeywords.size();
    }
}
