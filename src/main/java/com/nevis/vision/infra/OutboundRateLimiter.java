package com.nevis.vision.infra;

import java.util.function.Supplier;

/**
 * Throttles outbound calls per backend id.
 */
public interface OutboundRateLimiter {

    void acquire(String backendId);

    default <T> T execute(String backendId, Supplier<T> call) {
        acquire(backendId);
        return call.get();
    }
}
