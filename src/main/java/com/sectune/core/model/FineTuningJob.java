package com.sectune.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * A fine-tuning run tracked from data assembly to its terminal outcome.
 *
 * @param id               store-assigned identifier (null before creation)
 * @param providerJobId    handle returned by the fine-tuning provider on submission
 */
public record FineTuningJob(
    Long id,
    String jobName,
    String modelType,
    String baseModel,
    JobStatus status,
    int trainingDataCount,
    Hyperparameters hyperparameters,
    String providerJobId,
    String fineTunedModelId,
    String errorMessage,
    Instant createdAt,
    Instant updatedAt,
    Instant completedAt
) implements Serializable {

    public static FineTuningJob preparing(String jobName, String modelType, String baseModel,
                                          Hyperparameters hyperparameters, Instant now) {
        return new FineTuningJob(null, jobName, modelType, baseModel, JobStatus.PREPARING, 0,
                hyperparameters, null, null, null, now, now, null);
    }

    public FineTuningJob withId(long newId) {
        return new FineTuningJob(newId, jobName, modelType, baseModel, status, trainingDataCount,
                hyperparameters, providerJobId, fineTunedModelId, errorMessage, createdAt, updatedAt, completedAt);
    }

    public FineTuningJob uploaded(String newProviderJobId, int dataCount, Instant now) {
        return new FineTuningJob(id, jobName, modelType, baseModel, JobStatus.DATA_UPLOADED, dataCount,
                hyperparameters, newProviderJobId, fineTunedModelId, errorMessage, createdAt, now, completedAt);
    }

    public FineTuningJob training(Instant now) {
        return new FineTuningJob(id, jobName, modelType, baseModel, JobStatus.TRAINING, trainingDataCount,
                hyperparameters, providerJobId, fineTunedModelId, errorMessage, createdAt, now, completedAt);
    }

    public FineTuningJob completed(String modelId, Instant now) {
        return new FineTuningJob(id, jobName, modelType, baseModel, JobStatus.COMPLETED, trainingDataCount,
                hyperparameters, providerJobId, modelId, errorMessage, createdAt, now, now);
    }

    public FineTuningJob failed(String message, Instant now) {
        return new FineTuningJob(id, jobName, modelType, baseModel, JobStatus.FAILED, trainingDataCount,
                hyperparameters, providerJobId, fineTunedModelId, message, createdAt, now, completedAt);
    }
}
