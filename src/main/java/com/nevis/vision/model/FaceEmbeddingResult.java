package com.nevis.vision.model;

import java.util.Optional;

public record FaceEmbeddingResult(
    Optional<Embedding> embedding,
    int faceCount,
    double faceConfidence,
    Optional<BoundingBox> facialArea,
    String modelVersion,
    long processingTimeMs
) {
    public static FaceEmbeddingResult noFace(String modelVersion, long processingTimeMs) {
        return new FaceEmbeddingResult(Optional.empty(), 0, 0, Optional.empty(), modelVersion, processingTimeMs);
    }

    public boolean hasFace() {
        return embedding.isPresent();
    }
}
