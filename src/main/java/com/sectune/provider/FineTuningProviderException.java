package com.sectune.provider;

/**
 * Thrown when the fine-tuning provider rejects a request or cannot be reached.
 */
public class FineTuningProviderException extends RuntimeException {
    public FineTuningProviderException(String message) {
        super(message);
    }

    public FineTuningProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
