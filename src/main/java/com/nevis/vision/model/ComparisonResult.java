package com.nevis.vision.model;

/**
 * Outcome of comparing two face embeddings. {@code similarity} is the cosine similarity and
 * {@code distance} is {@code 1 - similarity}.
 */
public record ComparisonResult(
    boolean isSamePerson,
    double distance,
    double similarity,
    ConfidenceTier confidence,
    String modelVersion,
    long processingTimeMs
) {
    public ComparisonResult {
        if (distance < 0) {
            throw new IllegalArgumentException("Distance cannot be negative: " + distance);
        }
        if (similarity < -1 || similarity > 1) {
            throw new IllegalArgumentException("Similarity out of range: " + similarity);
        }
    }
}
