package com.nevis.vision.classify;

import lombok.Getter;

/**
 * Failure taxonomy for backend calls. Retryability is fixed per kind.
 */
@Getter
public enum ErrorKind {

    INVALID_INPUT("invalid_input", false),
    INVALID_CREDENTIALS("invalid_credentials", false),
    RATE_LIMITED("rate_limited", true),
    UPSTREAM_SERVER_ERROR("upstream_error", true),
    UNKNOWN_UPSTREAM_ERROR("unknown_upstream_error", false),
    TIMEOUT("timeout", true),
    NETWORK_ERROR("network_error", true);

    private final String code;
    private final boolean retryable;

    ErrorKind(String code, boolean retryable) {
        this.code = code;
        this.retryable = retryable;
    }
}
