package com.nevis.vision.retry;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with multiplicative jitter.
 * <p>
 * For a 0-indexed attempt {@code n} the base delay is {@code baseDelayMs * 2^n}, capped at
 * {@code maxDelayMs}. Jitter moves it by at most {@code jitterFactor} of itself in either direction,
 * so no delay exceeds {@code maxDelayMs * (1 + jitterFactor)}.
 */
public class BackoffPolicy {

    private final DoubleSupplier random;

    public BackoffPolicy() {
        this(() -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param random source of uniform values in [0, 1)
     */
    public BackoffPolicy(DoubleSupplier random) {
        this.random = random;
    }

    public long nextDelay(int attempt, RetryConfig config) {
        double capped = cappedDelay(attempt, config);
        if (config.jitterFactor() == 0) {
            return (long) capped;
        }
        double r = random.getAsDouble();
        double jitter = capped * config.jitterFactor() * (2 * r - 1);
        return Math.max(0, Math.round(capped + jitter));
    }

    public static long cappedDelay(int attempt, RetryConfig config) {
        if (attempt < 0) {
            throw new IllegalArgumentException("Attempt index cannot be negative: " + attempt);
        }
        double exponential = config.baseDelayMs() * Math.pow(2, attempt);
        return (long) Math.min(exponential, config.maxDelayMs());
    }
}
