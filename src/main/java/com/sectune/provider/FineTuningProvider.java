package com.sectune.provider;

import com.sectune.core.model.ChatMessage;
import com.sectune.core.model.Hyperparameters;
import com.sectune.core.model.TrainingExample;

import java.util.List;

/**
 * External service that trains fine-tuned models and serves them.
 * <p>
 * Implementations throw {@link FineTuningProviderException} for transport and
 * service errors, and {@link ProviderTimeoutException} when a call exceeds its bound.
 */
public interface FineTuningProvider {

    /**
     * Uploads the examples as a named training file and starts a training job.
     *
     * @return the provider's job handle
     */
    String submit(String fileName, List<TrainingExample> examples, String baseModel,
                  Hyperparameters hyperparameters);

    /**
     * Fetches the current state of a provider job.
     */
    ProviderJobStatus status(String providerJobId);

    /**
     * Invokes a model with a message sequence and returns the completion text.
     */
    String complete(String modelId, List<ChatMessage> messages);

    /** Short identifier used in logs and health output. */
    String name();
}
