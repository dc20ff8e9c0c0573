package com.nevis.vision.retry;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.retry.backoff.Sleeper;

@Slf4j
public class JitteredBackOffPolicy implements BackOffPolicy {

    private final BackoffPolicy backoffPolicy;
    private final RetryConfig config;
    private final Sleeper sleeper;

    public JitteredBackOffPolicy(BackoffPolicy backoffPolicy, RetryConfig config, Sleeper sleeper) {
        this.backoffPolicy = backoffPolicy;
        this.config = config;
        this.sleeper = sleeper;
    }

    @Override
    public BackOffContext start(RetryContext context) {
        return new AttemptContext();
    }

    @Override
    public void backOff(BackOffContext backOffContext) throws BackOffInterruptedException {
        AttemptContext attempts = (AttemptContext) backOffContext;
        long delay = backoffPolicy.nextDelay(attempts.next(), config);
        log.debug("Backing off for {}ms", delay);
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackOffInterruptedException("Interrupted while backing off", e);
        }
    }

    private static final class AttemptContext implements BackOffContext {

        private int attempt;

        int next() {
            return attempt++;
        }
    }
}
