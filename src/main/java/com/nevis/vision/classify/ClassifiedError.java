package com.nevis.vision.classify;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A backend failure reduced to its kind, retryability and the upstream messages, kept verbatim.
 */
public record ClassifiedError(
    ErrorKind kind,
    Integer httpStatus,
    boolean retryable,
    List<String> messages
) {
    public static final String UNKNOWN_ERROR = "Unknown error";

    public ClassifiedError {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }

    public static ClassifiedError of(ErrorKind kind, Integer httpStatus, List<String> messages) {
        return new ClassifiedError(kind, httpStatus, kind.isRetryable(), messages);
    }

    /**
     * Terminal form of a rate-limit condition that outlived the retry budget.
     */
    public static ClassifiedError rateLimitExhausted(int attemptsMade, List<String> upstreamMessages) {
        List<String> messages = new ArrayList<>(upstreamMessages);
        messages.add("Rate limit exceeded after " + attemptsMade + " attempts");
        return new ClassifiedError(ErrorKind.RATE_LIMITED, 429, false, messages);
    }

    public String code() {
        return kind.getCode();
    }

    public Optional<Integer> status() {
        return Optional.ofNullable(httpStatus);
    }

    public String message() {
        String joined = String.join("; ", messages);
        return joined.isBlank() ? UNKNOWN_ERROR : joined;
    }
}
