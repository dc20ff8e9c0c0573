package com.nevis.vision.retry;

import com.nevis.vision.classify.ClassifiedError;
import com.nevis.vision.classify.ErrorClassifier;
import com.nevis.vision.classify.ErrorKind;
import com.nevis.vision.exception.BackendCallException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RecoveryCallback;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Runs one backend call under a {@link RetryConfig} and reports the outcome as a {@link CallResult}
 * instead of throwing.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BackendRetryExecutor {

    private final ErrorClassifier errorClassifier;
    private final BackoffPolicy backoffPolicy;
    private final Sleeper sleeper;

    public <T> CallResult<T> execute(String backendId, RetryConfig config, Supplier<T> call) {
        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(new ClassifiedRetryPolicy(config));
        template.setBackOffPolicy(new JitteredBackOffPolicy(backoffPolicy, config, sleeper));
        template.registerListener(new AttemptLogger(backendId, config));

        AtomicReference<BackendCallException> lastFailure = new AtomicReference<>();
        AtomicInteger attemptsMade = new AtomicInteger();

        RetryCallback<CallResult<T>, BackendCallException> attempt = context -> {
            attemptsMade.incrementAndGet();
            try {
                return CallResult.success(call.get(), context.getRetryCount() + 1);
            } catch (BackendCallException e) {
                lastFailure.set(e);
                throw e;
            } catch (RuntimeException e) {
                BackendCallException failure = new BackendCallException(errorClassifier.classify(e), e);
                lastFailure.set(failure);
                throw failure;
            }
        };
        RecoveryCallback<CallResult<T>> recovery = context -> recover(backendId, context);

        try {
            return template.execute(attempt, recovery);
        } catch (BackOffInterruptedException e) {
            // interrupt flag already restored by the backoff policy
            ClassifiedError error = errorClassifier.classify(lastFailure.get());
            log.warn("Backend {} retry interrupted after {} attempt(s): {}", backendId, attemptsMade.get(), error.code());
            return CallResult.failure(error, attemptsMade.get());
        }
    }

    private <T> CallResult<T> recover(String backendId, RetryContext context) {
        int attemptsMade = context.getRetryCount();
        ClassifiedError error = errorClassifier.classify(context.getLastThrowable());

        if (error.kind() == ErrorKind.RATE_LIMITED && error.retryable()) {
            log.warn("Backend {} still rate limited after {} attempts", backendId, attemptsMade);
            return CallResult.failure(ClassifiedError.rateLimitExhausted(attemptsMade, error.messages()), attemptsMade);
        }

        log.warn("Backend {} call failed after {} attempt(s): {} ({})",
            backendId, attemptsMade, error.code(), error.message());
        return CallResult.failure(error, attemptsMade);
    }

    private static final class AttemptLogger implements RetryListener {

        private final String backendId;
        private final RetryConfig config;

        private AttemptLogger(String backendId, RetryConfig config) {
            this.backendId = backendId;
            this.config = config;
        }

        @Override
        public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback, Throwable throwable) {
            log.debug("Backend {} attempt {}/{} failed: {}",
                backendId, context.getRetryCount(), config.maxAttempts(), throwable.getMessage());
        }
    }
}
