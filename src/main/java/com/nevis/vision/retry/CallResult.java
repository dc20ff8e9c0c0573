package com.nevis.vision.retry;

import com.nevis.vision.classify.ClassifiedError;
import com.nevis.vision.classify.ErrorKind;
import com.nevis.vision.exception.BackendCallException;
import com.nevis.vision.exception.RateLimitExhaustedException;

import java.util.Optional;

/**
 * Outcome of the backend-call stage: a value or a classified error, plus the attempts spent.
 */
public final class CallResult<T> {

    private final T value;
    private final ClassifiedError error;
    private final int attemptsMade;

    private CallResult(T value, ClassifiedError error, int attemptsMade) {
        this.value = value;
        this.error = error;
        this.attemptsMade = attemptsMade;
    }

    public static <T> CallResult<T> success(T value, int attemptsMade) {
        return new CallResult<>(value, null, attemptsMade);
    }

    public static <T> CallResult<T> failure(ClassifiedError error, int attemptsMade) {
        if (error == null) {
            throw new IllegalArgumentException("Failure requires an error");
        }
        return new CallResult<>(null, error, attemptsMade);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    public T value() {
        if (isFailure()) {
            throw new IllegalStateException("No value on a failed call: " + error.code());
        }
        return value;
    }

    public Optional<ClassifiedError> error() {
        return Optional.ofNullable(error);
    }

    public int attemptsMade() {
        return attemptsMade;
    }

    public boolean isRateLimitExhausted() {
        return isFailure() && error.kind() == ErrorKind.RATE_LIMITED && !error.retryable();
    }

    public T getOrThrow() {
        if (isSuccess()) {
            return value;
        }
        if (isRateLimitExhausted()) {
            throw new RateLimitExhaustedException(error, attemptsMade);
        }
        throw new BackendCallException(error);
    }

    @Override
    public String toString() {
        return isSuccess()
            ? "CallResult[success, attempts=" + attemptsMade + "]"
            : "CallResult[" + error.code() + ", attempts=" + attemptsMade + "]";
    }
}
