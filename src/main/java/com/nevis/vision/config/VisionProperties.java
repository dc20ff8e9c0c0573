package com.nevis.vision.config;

import com.nevis.vision.model.ReverseSearchProvider;
import com.nevis.vision.retry.RetryConfig;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "app.vision")
public record VisionProperties(
    @Valid @NotNull Embedding embedding,
    @Valid @NotNull Face face,
    @Valid @NotNull Deepfake deepfake,
    @Valid @NotNull ReverseSearch reverseSearch,
    @Valid @NotNull Availability availability,
    @Valid @NotNull Retry retry
) {

    public record Embedding(
        @NotBlank String baseUrl,
        String apiKey,
        @NotNull Duration timeout,
        @Min(1) int requestsPerMinute,
        @Min(1) int dimension,
        @NotBlank String modelVersion
    ) {}

    public record Face(
        @NotBlank String baseUrl,
        @NotNull Duration timeout,
        @Min(1) int requestsPerMinute,
        @DecimalMin("0.0") @DecimalMax("2.0") double threshold,
        @Min(1) int dimension,
        @NotBlank String modelVersion
    ) {}

    public record Deepfake(
        @NotBlank String baseUrl,
        String apiKey,
        @NotNull Duration timeout,
        @Min(1) int requestsPerMinute,
        @NotBlank String modelVersion
    ) {}

    public record ReverseSearch(
        @NotNull ReverseSearchProvider provider,
        String baseUrl,
        String apiKey,
        @NotNull Duration timeout,
        @Min(1) int requestsPerMinute
    ) {

        public String resolvedBaseUrl() {
            return baseUrl == null || baseUrl.isBlank() ? provider.getDefaultBaseUrl() : baseUrl;
        }
    }

    public record Availability(
        @NotNull Duration successTtl,
        @NotNull Duration failureTtl,
        @Min(1) @Max(10) int probeAttempts,
        @NotNull Duration probePause,
        @NotNull Duration probeTimeout
    ) {}

    public record Retry(
        @Min(0) int maxRetries,
        @Min(1) long baseDelayMs,
        @Min(1) long maxDelayMs,
        @DecimalMin("0.0") @DecimalMax("1.0") double jitterFactor
    ) {

        @AssertTrue(message = "max-delay-ms must not be lower than base-delay-ms")
        public boolean isDelayRangeValid() {
            return maxDelayMs >= baseDelayMs;
        }

        public RetryConfig toRetryConfig() {
            return new RetryConfig(maxRetries, baseDelayMs, maxDelayMs, jitterFactor);
        }
    }
}
