package com.nevis.vision.worker;

import com.nevis.vision.availability.AvailabilityCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@Slf4j
@RequiredArgsConstructor
public class AvailabilityRefreshWorker {

    private final AvailabilityCache availabilityCache;

    @Scheduled(fixedDelayString = "${app.vision.availability.refresh-interval-ms:30000}")
    public void refreshStale() {
        List<String> stale = availabilityCache.staleBackends();
        if (stale.isEmpty()) {
            return;
        }

        log.debug("Re-probing stale backends: {}", stale);
        stale.forEach(availabilityCache::probe);
    }
}
