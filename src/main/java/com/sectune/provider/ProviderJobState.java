package com.sectune.provider;

/**
 * Provider-side job states, normalised from the provider's wire values.
 */
public enum ProviderJobState {
    QUEUED,
    RUNNING,
    SUCCEEDED,
    FAILED,
    CANCELLED,
    /** Any state this version does not recognise. */
    UNKNOWN
}
