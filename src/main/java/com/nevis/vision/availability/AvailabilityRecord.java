package com.nevis.vision.availability;

import java.time.Duration;
import java.time.Instant;

/**
 * Last probe outcome for one backend.
 */
public record AvailabilityRecord(boolean available, Instant observedAt) {

    /**
     * A record stays fresh for {@code successTtl} when available and {@code failureTtl} otherwise.
     */
    public boolean isFresh(Instant now, Duration successTtl, Duration failureTtl) {
        Duration ttl = available ? successTtl : failureTtl;
        return Duration.between(observedAt, now).compareTo(ttl) < 0;
    }
}
