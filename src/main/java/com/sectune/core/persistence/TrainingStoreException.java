package com.sectune.core.persistence;

/**
 * Thrown when the backing store cannot complete an operation.
 */
public class TrainingStoreException extends RuntimeException {
    public TrainingStoreException(String message) {
        super(message);
    }

    public TrainingStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
