package com.nevis.vision.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.nevis.vision.exception.InvalidInputException;

public enum SortOrder {
    ASC,
    DESC;

    @JsonValue
    public String param() {
        return name().toLowerCase();
    }

    public static SortOrder from(String value) {
        if (value == null || value.isBlank()) {
            return DESC;
        }
        for (SortOrder order : values()) {
            if (order.name().equalsIgnoreCase(value.trim())) {
                return order;
            }
        }
        throw new InvalidInputException("Unknown sort order: " + value);
    }
}
