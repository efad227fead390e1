package com.sectune.core.orchestrator;

import com.sectune.core.model.Hyperparameters;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "sectune.training")
public class TrainingProperties {

    private int minimumJobThreshold = 50;
    private double triggerConfidenceThreshold = 0.5;
    private int batchLimit = 100;
    private int minimumValidExamples = 10;
    private String modelType = "security-analyst";
    private String baseModel = "gpt-4o-mini-2024-07-18";
    private int leaseTtlMinutes = 30;
    private Hyper hyperparameters = new Hyper();

    public int getMinimumJobThreshold() { return minimumJobThreshold; }
    public void setMinimumJobThreshold(int minimumJobThreshold) { this.minimumJobThreshold = minimumJobThreshold; }
    public double getTriggerConfidenceThreshold() { return triggerConfidenceThreshold; }
    public void setTriggerConfidenceThreshold(double triggerConfidenceThreshold) { this.triggerConfidenceThreshold = triggerConfidenceThreshold; }
    public int getBatchLimit() { return batchLimit; }
    public void setBatchLimit(int batchLimit) { this.batchLimit = batchLimit; }
    public int getMinimumValidExamples() { return minimumValidExamples; }
    public void setMinimumValidExamples(int minimumValidExamples) { this.minimumValidExamples = minimumValidExamples; }
    public String getModelType() { return modelType; }
    public void setModelType(String modelType) { this.modelType = modelType; }
    public String getBaseModel() { return baseModel; }
    public void setBaseModel(String baseModel) { this.baseModel = baseModel; }
    public int getLeaseTtlMinutes() { return leaseTtlMinutes; }
    public void setLeaseTtlMinutes(int leaseTtlMinutes) { this.leaseTtlMinutes = leaseTtlMinutes; }
    public Hyper getHyperparameters() { return hyperparameters; }
    public void setHyperparameters(Hyper hyperparameters) { this.hyperparameters = hyperparameters; }

    public Hyperparameters toHyperparameters() {
        return new Hyperparameters(hyperparameters.epochs, hyperparameters.batchSize,
                hyperparameters.learningRateMultiplier);
    }

    public static class Hyper {
        private int epochs = 3;
        private int batchSize = 4;
        private double learningRateMultiplier = 1.0;

        public int getEpochs() { return epochs; }
        public void setEpochs(int epochs) { this.epochs = epochs; }
        public int getBatchSize() { return batchSize; }
        public void setBatchSize(int batchSize) { this.batchSize = batchSize; }
        public double getLearningRateMultiplier() { return learningRateMultiplier; }
        public void setLearningRateMultiplier(double learningRateMultiplier) { this.learningRateMultiplier = learningRateMultiplier; }
    }
}
