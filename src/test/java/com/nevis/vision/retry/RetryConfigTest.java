package com.nevis.vision.retry;

import com.nevis.vision.exception.InvalidInputException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryConfigTest {

    @Test
    void defaultsShouldMatchDocumentedValues() {
        assertThat(RetryConfig.DEFAULTS.maxRetries()).isEqualTo(5);
        assertThat(RetryConfig.DEFAULTS.baseDelayMs()).isEqualTo(1000);
        assertThat(RetryConfig.DEFAULTS.maxDelayMs()).isEqualTo(30_000);
        assertThat(RetryConfig.DEFAULTS.jitterFactor()).isEqualTo(0.1);
        assertThat(RetryConfig.DEFAULTS.maxAttempts()).isEqualTo(6);
    }

    @Test
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> new RetryConfig(-1, 1000, 30_000, 0.1)).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> new RetryConfig(3, 0, 30_000, 0.1)).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> new RetryConfig(3, 1000, 500, 0.1)).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> new RetryConfig(3, 1000, 30_000, 1.5)).isInstanceOf(InvalidInputException.class);
    }
}
