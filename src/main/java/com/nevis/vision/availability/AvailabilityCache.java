package com.nevis.vision.availability;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.backoff.Sleeper;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Remembers whether each backend answered its health probe, trusting a success longer than a
 * failure. Entries are overwritten whole, last writer wins.
 */
@Slf4j
public class AvailabilityCache {

    private final Map<String, HealthProbe> probes;
    private final Map<String, AvailabilityRecord> records = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Sleeper sleeper;
    private final Duration successTtl;
    private final Duration failureTtl;
    private final int probeAttempts;
    private final Duration probePause;

    public AvailabilityCache(List<HealthProbe> probes, Clock clock, Sleeper sleeper,
                             Duration successTtl, Duration failureTtl,
                             int probeAttempts, Duration probePause) {
        if (probeAttempts < 1) {
            throw new IllegalArgumentException("At least one probe attempt is required");
        }
        this.probes = probes.stream()
            .collect(Collectors.toMap(HealthProbe::backendId, Function.identity(), (a, b) -> a, LinkedHashMap::new));
        this.clock = clock;
        this.sleeper = sleeper;
        this.successTtl = successTtl;
        this.failureTtl = failureTtl;
        this.probeAttempts = probeAttempts;
        this.probePause = probePause;
    }

    /**
     * Answers from a fresh record when there is one, otherwise probes first. Never throws for
     * probe failures.
     */
    public boolean isAvailable(String backendId) {
        AvailabilityRecord current = records.get(backendId);
        if (current != null && current.isFresh(clock.instant(), successTtl, failureTtl)) {
            return current.available();
        }
        return probe(backendId);
    }

    public boolean probe(String backendId) {
        HealthProbe probe = probes.get(backendId);
        if (probe == null) {
            throw new IllegalArgumentException("Unknown backend: " + backendId);
        }

        if (!probe.isConfigured()) {
            log.debug("Backend {} is not configured, skipping probe", backendId);
            store(backendId, false);
            return false;
        }

        boolean healthy = false;
        for (int attempt = 1; attempt <= probeAttempts && !healthy; attempt++) {
            if (attempt > 1 && !pause()) {
                break;
            }
            healthy = attemptProbe(probe, attempt);
        }
        store(backendId, healthy);
        return healthy;
    }

    /**
     * Records a failure observed outside a probe, e.g. a real call that failed terminally.
     */
    public void markUnavailable(String backendId) {
        store(backendId, false);
    }

    public BackendState state(String backendId) {
        AvailabilityRecord current = records.get(backendId);
        if (current == null || !current.isFresh(clock.instant(), successTtl, failureTtl)) {
            return BackendState.UNPROBED;
        }
        return current.available() ? BackendState.AVAILABLE : BackendState.UNAVAILABLE;
    }

    public Map<String, BackendState> snapshot() {
        Map<String, BackendState> states = new LinkedHashMap<>();
        probes.keySet().forEach(backendId -> states.put(backendId, state(backendId)));
        return states;
    }

    public List<String> backendIds() {
        return List.copyOf(probes.keySet());
    }

    public List<String> staleBackends() {
        return probes.keySet().stream()
            .filter(backendId -> state(backendId) == BackendState.UNPROBED)
            .toList();
    }

    private boolean attemptProbe(HealthProbe probe, int attempt) {
        try {
            boolean healthy = probe.check();
            if (!healthy) {
                log.debug("Backend {} reported unhealthy (attempt {}/{})", probe.backendId(), attempt, probeAttempts);
            }
            return healthy;
        } catch (RuntimeException e) {
            log.warn("Health check for {} failed (attempt {}/{}): {}",
                probe.backendId(), attempt, probeAttempts, e.getMessage());
            return false;
        }
    }

    private boolean pause() {
        try {
            sleeper.sleep(probePause.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void store(String backendId, boolean available) {
        AvailabilityRecord previous = records.put(backendId, new AvailabilityRecord(available, clock.instant()));
        if (previous == null || previous.available() != available) {
            log.info("Backend {} is {}, using {} results", backendId,
                available ? "available" : "unavailable", available ? "real" : "synthetic");
        }
    }
}
