package com.nevis.vision.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.nevis.vision.exception.InvalidInputException;

public enum SortField {
    SCORE("score"),
    SIZE("size"),
    CRAWL_DATE("crawl_date");

    private final String param;

    SortField(String param) {
        this.param = param;
    }

    @JsonValue
    public String param() {
        return param;
    }

    /**
     * Accepts the wire name or the constant name, any case. {@code null} means the default.
     */
    public static SortField from(String value) {
        if (value == null || value.isBlank()) {
            return SCORE;
        }
        for (SortField field : values()) {
            if (field.param.equalsIgnoreCase(value.trim()) || field.name().equalsIgnoreCase(value.trim())) {
                return field;
            }
        }
        throw new InvalidInputException("Unknown sort field: " + value);
    }
}
