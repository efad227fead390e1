package com.sectune.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Append-only result of one evaluation run against a fine-tuned model.
 */
public record PerformanceRecord(
    String modelId,
    String evaluationType,
    double score,
    int testDataSize,
    Instant evaluationDate
) implements Serializable {}
