package com.sectune.core.model;

import java.io.Serializable;

/**
 * Training hyperparameters copied onto each job at creation.
 */
public record Hyperparameters(
    int epochs,
    int batchSize,
    double learningRateMultiplier
) implements Serializable {}
