package com.nevis.vision.scoring;

import com.nevis.vision.model.ComparisonResult;
import com.nevis.vision.model.Embedding;
import dev.langchain4j.store.embedding.CosineSimilarity;

public final class VectorMath {

    private VectorMath() {
    }

    /**
     * Cosine similarity clamped to [-1, 1]; 0 when either vector has zero magnitude.
     */
    public static double cosineSimilarity(Embedding a, Embedding b) {
        if (a.dimension() != b.dimension()) {
            throw new IllegalArgumentException(
                "Vector dimensions must match: " + a.dimension() + " vs " + b.dimension());
        }
        double similarity = CosineSimilarity.between(
            dev.langchain4j.data.embedding.Embedding.from(a.vector()),
            dev.langchain4j.data.embedding.Embedding.from(b.vector()));
        return Math.max(-1, Math.min(1, similarity));
    }

    public static ComparisonResult compare(Embedding a, Embedding b, double threshold,
                                           String modelVersion, long processingTimeMs) {
        double similarity = cosineSimilarity(a, b);
        return fromDistance(1 - similarity, threshold, modelVersion, processingTimeMs);
    }

    public static ComparisonResult fromDistance(double distance, double threshold,
                                                String modelVersion, long processingTimeMs) {
        double bounded = Math.max(0, Math.min(2, distance));
        return new ComparisonResult(
            ConfidenceScorer.isSamePerson(bounded, threshold),
            bounded,
            1 - bounded,
            ConfidenceScorer.marginToConfidence(bounded, threshold),
            modelVersion,
            processingTimeMs
        );
    }
}
