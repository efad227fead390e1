package com.sectune.core.evaluation;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "sectune.evaluation")
public class EvaluationProperties {

    private double minConfidence = 0.8;
    private int sampleSize = 20;
    private boolean autoEvaluate = true;

    public double getMinConfidence() {
        return minConfidence;
    }

    public void setMinConfidence(double minConfidence) {
        this.minConfidence = minConfidence;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public void setSampleSize(int sampleSize) {
        this.sampleSize = sampleSize;
    }

    public boolean isAutoEvaluate() {
        return autoEvaluate;
    }

    public void setAutoEvaluate(boolean autoEvaluate) {
        this.autoEvaluate = autoEvaluate;
    }
}
