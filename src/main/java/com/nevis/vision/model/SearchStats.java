package com.nevis.vision.model;

public record SearchStats(
    long queryTimeMs,
    int totalResults,
    int totalBacklinks
) {}
