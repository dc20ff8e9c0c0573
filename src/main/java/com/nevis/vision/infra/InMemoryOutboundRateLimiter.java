package com.nevis.vision.infra;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
public class InMemoryOutboundRateLimiter implements OutboundRateLimiter {

    private final ConcurrentHashMap<String, Bucket> buckets = new ConcurrentHashMap<>();
    private final Map<String, Integer> requestsPerMinute;
    private final int defaultRequestsPerMinute;

    public InMemoryOutboundRateLimiter(Map<String, Integer> requestsPerMinute, int defaultRequestsPerMinute) {
        this.requestsPerMinute = Map.copyOf(requestsPerMinute);
        this.defaultRequestsPerMinute = defaultRequestsPerMinute;
    }

    private Bucket createBucket(String backendId) {
        int rpm = requestsPerMinute.getOrDefault(backendId, defaultRequestsPerMinute);
        log.debug("Creating outbound bucket for {} at {} requests/minute", backendId, rpm);
        return Bucket.builder()
            .addLimit(Bandwidth.builder().capacity(rpm).refillGreedy(rpm, Duration.ofMinutes(1)).build())
            .build();
    }

    @Override
    public void acquire(String backendId) {
        Bucket bucket = buckets.computeIfAbsent(backendId, this::createBucket);
        try {
            bucket.asBlocking().consume(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for " + backendId + " rate limit", e);
        }
    }

    public long availableTokens(String backendId) {
        return buckets.computeIfAbsent(backendId, this::createBucket).getAvailableTokens();
    }
}
