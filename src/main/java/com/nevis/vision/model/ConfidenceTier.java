package com.nevis.vision.model;

/**
 * Discrete confidence bucket. Declaration order is the ordering LOW < MEDIUM < HIGH.
 */
public enum ConfidenceTier {
    LOW,
    MEDIUM,
    HIGH
}
