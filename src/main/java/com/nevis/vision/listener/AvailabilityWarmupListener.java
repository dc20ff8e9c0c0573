package com.nevis.vision.listener;

import com.nevis.vision.availability.AvailabilityCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Probes every backend once at startup so the first requests do not pay for the probe.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AvailabilityWarmupListener {

    private final AvailabilityCache availabilityCache;

    @Async("visionTaskExecutor")
    @EventListener(ApplicationReadyEvent.class)
    public void warmUp() {
        log.info("Probing {} vision backends", availabilityCache.backendIds().size());
        availabilityCache.backendIds().forEach(availabilityCache::probe);
        log.info("Initial backend availability: {}", availabilityCache.snapshot());
    }
}
