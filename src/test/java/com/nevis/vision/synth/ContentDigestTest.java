package com.nevis.vision.synth;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class ContentDigestTest {

    private final ContentDigest digest = ContentDigest.of("hello".getBytes(StandardCharsets.UTF_8));

    @Test
    void shouldUseSha256Hex() {
        assertThat(digest.hex()).isEqualTo("2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824");
    }

    @Test
    void shouldDrawReproduciblyPerFacet() {
        assertThat(digest.draw("face_detection")).isEqualTo(digest.draw("face_detection"));
        assertThat(digest.draw("face_detection")).isNotEqualTo(digest.draw("deepfake"));
        assertThat(digest.draw("match")).isGreaterThanOrEqualTo(0.0).isLessThan(1.0);
    }

    @Test
    void shouldReadOverlappingWindowsIntoUnitRange() {
        double[] raw = digest.rawVector(64);

        // first window is "2cf2"
        assertThat(raw[0]).isEqualTo(0x2cf2 / (double) 0xffff * 2 - 1);
        // windows wrap every 30 coordinates
        assertThat(raw[30]).isEqualTo(raw[0]);
        for (double value : raw) {
            assertThat(value).isBetween(-1.0, 1.0);
        }
    }

    @Test
    void shouldPickWithinBound() {
        for (int i = 0; i < 50; i++) {
            assertThat(digest.pick("facet" + i, 7)).isBetween(0, 6);
        }
    }
}
