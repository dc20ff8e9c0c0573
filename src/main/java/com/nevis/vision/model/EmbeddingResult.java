package com.nevis.vision.model;

public record EmbeddingResult(
    Embedding embedding,
    String modelVersion,
    long processingTimeMs
) {}
