package com.nevis.vision.retry;

import com.nevis.vision.exception.BackendCallException;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryPolicy;
import org.springframework.retry.context.RetryContextSupport;

/**
 * Retries only failures classified as retryable, and only while the retry budget lasts.
 */
public class ClassifiedRetryPolicy implements RetryPolicy {

    private final RetryConfig config;

    public ClassifiedRetryPolicy(RetryConfig config) {
        this.config = config;
    }

    @Override
    public boolean canRetry(RetryContext context) {
        Throwable last = context.getLastThrowable();
        if (last == null) {
            return true;
        }
        if (!(last instanceof BackendCallException callException)) {
            return false;
        }
        return callException.getError().retryable() && context.getRetryCount() <= config.maxRetries();
    }

    @Override
    public RetryContext open(RetryContext parent) {
        return new RetryContextSupport(parent);
    }

    @Override
    public void close(RetryContext context) {
    }

    @Override
    public void registerThrowable(RetryContext context, Throwable throwable) {
        ((RetryContextSupport) context).registerThrowable(throwable);
    }

    @Override
    public int getMaxAttempts() {
        return config.maxAttempts();
    }
}
