package com.sectune.provider;

/**
 * Snapshot of a provider job.
 *
 * @param state           normalised state
 * @param rawState        the provider's own state string, kept for logging
 * @param fineTunedModel  resulting model id, present once the job succeeded
 * @param error           failure detail reported by the provider, if any
 */
public record ProviderJobStatus(
    ProviderJobState state,
    String rawState,
    String fineTunedModel,
    String error
) {}
