package com.sectune.provider;

/**
 * Thrown when a provider call does not complete within its configured bound.
 */
public class ProviderTimeoutException extends FineTuningProviderException {
    public ProviderTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
