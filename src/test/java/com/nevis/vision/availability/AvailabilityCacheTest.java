package com.nevis.vision.availability;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AvailabilityCacheTest {

    private static final String BACKEND = "image-similarity";

    private final MutableClock clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
    private final List<Long> pauses = new ArrayList<>();
    private ScriptedProbe probe;
    private AvailabilityCache cache;

    @BeforeEach
    void setUp() {
        probe = new ScriptedProbe(BACKEND, true);
        cache = cacheWith(probe);
    }

    private AvailabilityCache cacheWith(HealthProbe... probes) {
        return new AvailabilityCache(List.of(probes), clock, pauses::add,
            Duration.ofSeconds(60), Duration.ofSeconds(5), 2, Duration.ofMillis(500));
    }

    @Test
    @DisplayName("A healthy answer is trusted for the success TTL")
    void shouldTrustSuccessForSixtySeconds() {
        probe.answers(true);

        assertThat(cache.isAvailable(BACKEND)).isTrue();
        clock.advance(Duration.ofSeconds(59));
        assertThat(cache.isAvailable(BACKEND)).isTrue();
        assertThat(probe.calls).isEqualTo(1);

        clock.advance(Duration.ofSeconds(1));
        cache.isAvailable(BACKEND);
        assertThat(probe.calls).isEqualTo(2);
    }

    @Test
    @DisplayName("A failure is re-probed after five seconds")
    void shouldReprobeFailureAfterFiveSeconds() {
        probe.answers(false, false, true);

        assertThat(cache.isAvailable(BACKEND)).isFalse();
        assertThat(probe.calls).isEqualTo(2);
        assertThat(pauses).containsExactly(500L);

        clock.advance(Duration.ofSeconds(4));
        assertThat(cache.isAvailable(BACKEND)).isFalse();
        assertThat(probe.calls).isEqualTo(2);

        clock.advance(Duration.ofSeconds(1));
        assertThat(cache.isAvailable(BACKEND)).isTrue();
        assertThat(probe.calls).isEqualTo(3);
    }

    @Test
    @DisplayName("The first healthy attempt ends the probe")
    void shouldShortCircuitOnFirstSuccess() {
        probe.answers(false, true);

        assertThat(cache.isAvailable(BACKEND)).isTrue();
        assertThat(probe.calls).isEqualTo(2);

        ScriptedProbe healthy = new ScriptedProbe("face-recognition", true);
        AvailabilityCache other = cacheWith(healthy);
        pauses.clear();
        assertThat(other.isAvailable("face-recognition")).isTrue();
        assertThat(healthy.calls).isEqualTo(1);
        assertThat(pauses).isEmpty();
    }

    @Test
    @DisplayName("Probe exceptions count as failures and never reach the caller")
    void shouldSwallowProbeExceptions() {
        probe.failWith(new IllegalStateException("connection refused"));

        assertThat(cache.isAvailable(BACKEND)).isFalse();
        assertThat(cache.state(BACKEND)).isEqualTo(BackendState.UNAVAILABLE);
    }

    @Test
    void shouldSkipNetworkWhenNotConfigured() {
        ScriptedProbe unconfigured = new ScriptedProbe("deepfake-detection", false);
        AvailabilityCache withUnconfigured = cacheWith(unconfigured);

        assertThat(withUnconfigured.isAvailable("deepfake-detection")).isFalse();
        assertThat(unconfigured.calls).isZero();
    }

    @Test
    void shouldReportStatesWithoutProbing() {
        assertThat(cache.snapshot()).isEqualTo(Map.of(BACKEND, BackendState.UNPROBED));
        assertThat(cache.staleBackends()).containsExactly(BACKEND);

        cache.markUnavailable(BACKEND);

        assertThat(cache.state(BACKEND)).isEqualTo(BackendState.UNAVAILABLE);
        assertThat(probe.calls).isZero();
        clock.advance(Duration.ofSeconds(5));
        assertThat(cache.state(BACKEND)).isEqualTo(BackendState.UNPROBED);
    }

    @Test
    void shouldRejectUnknownBackend() {
        assertThatThrownBy(() -> cache.probe("nope")).isInstanceOf(IllegalArgumentException.class);
    }

    private static final class ScriptedProbe implements HealthProbe {

        private final String backendId;
        private final boolean configured;
        private final Deque<Boolean> script = new LinkedList<>();
        private RuntimeException failure;
        private int calls;

        private ScriptedProbe(String backendId, boolean configured) {
            this.backendId = backendId;
            this.configured = configured;
        }

        void answers(Boolean... answers) {
            script.addAll(List.of(answers));
        }

        void failWith(RuntimeException failure) {
            this.failure = failure;
        }

        @Override
        public String backendId() {
            return backendId;
        }

        @Override
        public boolean isConfigured() {
            return configured;
        }

        @Override
        public boolean check() {
            calls++;
            if (failure != null) {
                throw failure;
            }
            return script.isEmpty() || script.poll();
        }
    }

    private static final class MutableClock extends Clock {

        private Instant now;

        private MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
