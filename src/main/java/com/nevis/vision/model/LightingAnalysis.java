package com.nevis.vision.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum LightingAnalysis {
    CONSISTENT,
    INCONSISTENT,
    INCONCLUSIVE;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    /**
     * Lenient parse; anything unrecognised is {@link #INCONCLUSIVE}.
     */
    public static LightingAnalysis from(String value) {
        if (value == null) {
            return INCONCLUSIVE;
        }
        for (LightingAnalysis analysis : values()) {
            if (analysis.value().equalsIgnoreCase(value.trim())) {
                return analysis;
            }
        }
        return INCONCLUSIVE;
    }
}
