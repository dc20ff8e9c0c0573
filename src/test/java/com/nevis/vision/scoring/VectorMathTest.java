package com.nevis.vision.scoring;

import com.nevis.vision.model.ComparisonResult;
import com.nevis.vision.model.Embedding;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class VectorMathTest {

    private final Embedding a = Embedding.of(new float[]{1f, 2f, 3f});
    private final Embedding b = Embedding.of(new float[]{-2f, 0.5f, 4f});

    @Test
    @DisplayName("Cosine similarity is symmetric and 1 for identical vectors")
    void shouldBeSymmetric() {
        assertThat(VectorMath.cosineSimilarity(a, b)).isCloseTo(VectorMath.cosineSimilarity(b, a), within(1e-9));
        assertThat(VectorMath.cosineSimilarity(a, a)).isCloseTo(1.0, within(1e-6));
    }

    @Test
    void shouldRejectDimensionMismatch() {
        Embedding shorter = Embedding.of(new float[]{1f, 2f});
        assertThatThrownBy(() -> VectorMath.cosineSimilarity(a, shorter))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Similarity and distance always add up to one")
    void shouldKeepSimilarityAndDistanceConsistent() {
        ComparisonResult result = VectorMath.compare(a, b, 0.68, "test", 3);

        assertThat(result.similarity() + result.distance()).isCloseTo(1.0, within(1e-12));
        assertThat(result.isSamePerson()).isEqualTo(result.distance() <= 0.68);
        assertThat(result.processingTimeMs()).isEqualTo(3);
    }

    @Test
    void shouldClampOutOfRangeDistance() {
        ComparisonResult result = VectorMath.fromDistance(2.7, 0.68, "test", 0);

        assertThat(result.distance()).isEqualTo(2.0);
        assertThat(result.similarity()).isEqualTo(-1.0);
        assertThat(result.isSamePerson()).isFalse();
    }
}
