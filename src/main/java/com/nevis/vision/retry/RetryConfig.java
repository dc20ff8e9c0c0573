package com.nevis.vision.retry;

import com.nevis.vision.exception.InvalidInputException;

/**
 * Retry budget for one capability call. Resolved once per call and never changed afterwards.
 */
public record RetryConfig(
    int maxRetries,
    long baseDelayMs,
    long maxDelayMs,
    double jitterFactor
) {
    public static final RetryConfig DEFAULTS = new RetryConfig(5, 1000, 30_000, 0.1);

    public RetryConfig {
        if (maxRetries < 0) {
            throw new InvalidInputException("maxRetries cannot be negative: " + maxRetries);
        }
        if (baseDelayMs <= 0) {
            throw new InvalidInputException("baseDelayMs must be positive: " + baseDelayMs);
        }
        if (maxDelayMs < baseDelayMs) {
            throw new InvalidInputException("maxDelayMs must be >= baseDelayMs: " + maxDelayMs);
        }
        if (Double.isNaN(jitterFactor) || jitterFactor < 0 || jitterFactor > 1) {
            throw new InvalidInputException("jitterFactor must be within [0, 1]: " + jitterFactor);
        }
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }
}
