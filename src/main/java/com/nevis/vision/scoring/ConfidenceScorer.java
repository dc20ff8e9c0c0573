package com.nevis.vision.scoring;

import com.nevis.vision.model.ConfidenceTier;

/**
 * Turns continuous scores into confidence tiers.
 */
public final class ConfidenceScorer {

    public static final double HIGH_SCORE = 80;
    public static final double MEDIUM_SCORE = 50;

    public static final double HIGH_MARGIN = 0.15;
    public static final double MEDIUM_MARGIN = 0.05;

    private ConfidenceScorer() {
    }

    /**
     * Tier for a 0-100 match score. Lower bounds are inclusive: 80 is HIGH, 50 is MEDIUM.
     */
    public static ConfidenceTier scoreToConfidence(double score) {
        if (Double.isNaN(score)) {
            throw new IllegalArgumentException("Score cannot be NaN");
        }
        if (score >= HIGH_SCORE) {
            return ConfidenceTier.HIGH;
        }
        if (score >= MEDIUM_SCORE) {
            return ConfidenceTier.MEDIUM;
        }
        return ConfidenceTier.LOW;
    }

    /**
     * Tier for a face comparison, from how far the distance sits from the decision threshold.
     */
    public static ConfidenceTier marginToConfidence(double distance, double threshold) {
        double margin = Math.abs(distance - threshold);
        if (margin > HIGH_MARGIN) {
            return ConfidenceTier.HIGH;
        }
        if (margin > MEDIUM_MARGIN) {
            return ConfidenceTier.MEDIUM;
        }
        return ConfidenceTier.LOW;
    }

    public static boolean isSamePerson(double distance, double threshold) {
        return distance <= threshold;
    }
}
