package com.sectune.core.classifier;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "sectune.classifier")
public class ClassifierProperties {

    private int minimumMessages = 3;
    private int minimumKeywordMatches = 2;
    private double relevanceThreshold = 0.3;

    public int getMinimumMessages() {
        return minimumMessages;
    }

    public void setMinimumMessages(int minimumMessages) {
        this.minimumMessages = minimumMessages;
    }

    public int getMinimumKeywordMatches() {
        return minimumKeywordMatches;
    }

    public void setMinimumKeywordMatches(int minimumKeywordMatches) {
        this.minimumKeywordMatches = minimumKeywordMatches;
    }

    public double getRelevanceThreshold() {
        return relevanceThreshold;
    }

    public void setRelevanceThreshold(double relevanceThreshold) {
        this.relevanceThreshold = relevanceThreshold;
    }
}
