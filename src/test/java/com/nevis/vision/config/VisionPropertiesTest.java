package com.nevis.vision.config;

import com.nevis.vision.model.ReverseSearchProvider;
import com.nevis.vision.retry.RetryConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class VisionPropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
        .withUserConfiguration(PropertiesConfig.class)
        .withPropertyValues(
            "app.vision.embedding.base-url=http://embed",
            "app.vision.embedding.timeout=30s",
            "app.vision.embedding.requests-per-minute=60",
            "app.vision.embedding.dimension=512",
            "app.vision.embedding.model-version=clip",
            "app.vision.face.base-url=http://face",
            "app.vision.face.timeout=30s",
            "app.vision.face.requests-per-minute=60",
            "app.vision.face.threshold=0.68",
            "app.vision.face.dimension=512",
            "app.vision.face.model-version=facenet",
            "app.vision.deepfake.base-url=http://deepfake",
            "app.vision.deepfake.timeout=30s",
            "app.vision.deepfake.requests-per-minute=60",
            "app.vision.deepfake.model-version=detector",
            "app.vision.reverse-search.provider=google-vision",
            "app.vision.reverse-search.timeout=10s",
            "app.vision.reverse-search.requests-per-minute=30",
            "app.vision.availability.success-ttl=60s",
            "app.vision.availability.failure-ttl=5s",
            "app.vision.availability.probe-attempts=2",
            "app.vision.availability.probe-pause=500ms",
            "app.vision.availability.probe-timeout=5s",
            "app.vision.retry.max-retries=5",
            "app.vision.retry.base-delay-ms=1000",
            "app.vision.retry.max-delay-ms=30000",
            "app.vision.retry.jitter-factor=0.1");

    @Test
    void shouldBindNestedSections() {
        runner.run(context -> {
            VisionProperties properties = context.getBean(VisionProperties.class);

            assertThat(properties.reverseSearch().provider()).isEqualTo(ReverseSearchProvider.GOOGLE_VISION);
            assertThat(properties.reverseSearch().resolvedBaseUrl()).isEqualTo("https://vision.googleapis.com");
            assertThat(properties.availability().probePause()).isEqualTo(Duration.ofMillis(500));
            assertThat(properties.retry().toRetryConfig()).isEqualTo(RetryConfig.DEFAULTS);
            assertThat(properties.embedding().apiKey()).isNull();
        });
    }

    @Test
    void shouldFailOnInvalidThreshold() {
        runner.withPropertyValues("app.vision.face.threshold=3.5")
            .run(context -> assertThat(context).hasFailed());
    }

    @ParameterizedTest
    @ValueSource(strings = {"app.vision.retry.base-delay-ms=0", "app.vision.retry.max-delay-ms=500"})
    @DisplayName("Retry delays that no RetryConfig accepts fail at startup")
    void shouldFailOnUnusableRetryDelays(String property) {
        runner.withPropertyValues(property)
            .run(context -> assertThat(context).hasFailed());
    }

    @Configuration
    @EnableConfigurationProperties(VisionProperties.class)
    static class PropertiesConfig {
    }
}
