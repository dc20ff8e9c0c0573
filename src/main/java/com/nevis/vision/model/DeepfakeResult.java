package com.nevis.vision.model;

public record DeepfakeResult(
    boolean isDeepfake,
    double confidence,
    DeepfakeDetails details,
    String modelVersion,
    long processingTimeMs
) {
    public DeepfakeResult {
        if (confidence < 0 || confidence > 1) {
            throw new IllegalArgumentException("Invalid deepfake confidence: " + confidence);
        }
    }
}
