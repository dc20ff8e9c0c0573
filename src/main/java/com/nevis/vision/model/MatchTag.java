package com.nevis.vision.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum MatchTag {
    STOCK,
    COLLECTION;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    public static Optional<MatchTag> from(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (MatchTag tag : values()) {
            if (tag.value().equalsIgnoreCase(value.trim())) {
                return Optional.of(tag);
            }
        }
        return Optional.empty();
    }
}
