package com.voterimport.voterimport.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How a field mapping was established.
 */
public enum DetectionMethod {
    EXACT,
    ALIAS,
    PATTERN,
    MANUAL;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static DetectionMethod fromKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("Detection method is required");
        }
        return valueOf(key.trim().toUpperCase(Locale.ROOT));
    }
}
