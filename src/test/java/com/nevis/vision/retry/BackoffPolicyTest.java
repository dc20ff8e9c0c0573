package com.nevis.vision.retry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackoffPolicyTest {

    @Test
    @DisplayName("Without jitter the delay doubles per attempt until the cap")
    void shouldDoubleUntilCapped() {
        RetryConfig config = new RetryConfig(10, 1000, 30_000, 0);
        BackoffPolicy policy = new BackoffPolicy(() -> 0.99);

        assertThat(policy.nextDelay(0, config)).isEqualTo(1000);
        assertThat(policy.nextDelay(1, config)).isEqualTo(2000);
        assertThat(policy.nextDelay(4, config)).isEqualTo(16_000);
        assertThat(policy.nextDelay(5, config)).isEqualTo(30_000);
        assertThat(policy.nextDelay(40, config)).isEqualTo(30_000);
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.0, 0.25, 0.5, 0.999999})
    @DisplayName("Jittered delay never exceeds the cap by more than the jitter factor")
    void shouldBoundJitteredDelay(double draw) {
        RetryConfig config = RetryConfig.DEFAULTS;
        BackoffPolicy policy = new BackoffPolicy(() -> draw);

        for (int attempt = 0; attempt < 12; attempt++) {
            long delay = policy.nextDelay(attempt, config);
            assertThat(delay).isBetween(0L, (long) (config.maxDelayMs() * (1 + config.jitterFactor())));
        }
    }

    @Test
    void shouldSpreadJitterEvenlyAroundTheCappedDelay() {
        RetryConfig config = new RetryConfig(3, 1000, 30_000, 0.1);

        assertThat(new BackoffPolicy(() -> 0.0).nextDelay(0, config)).isEqualTo(900);
        assertThat(new BackoffPolicy(() -> 0.5).nextDelay(0, config)).isEqualTo(1000);
        assertThat(new BackoffPolicy(() -> 0.75).nextDelay(0, config)).isEqualTo(1050);
    }

    @Test
    void shouldRejectNegativeAttempt() {
        assertThatThrownBy(() -> BackoffPolicy.cappedDelay(-1, RetryConfig.DEFAULTS))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
