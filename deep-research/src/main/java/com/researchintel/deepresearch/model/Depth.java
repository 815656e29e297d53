package com.researchintel.deepresearch.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Depth {
    BRIEF(1),
    MEDIUM(2),
    DEEP(3);

    private final int keyPointsPerRecord;

    Depth(int keyPointsPerRecord) {
        this.keyPointsPerRecord = keyPointsPerRecord;
    }

    /** Number of leading sentences kept as key points for each fetched document. */
    public int keyPointsPerRecord() {
        return keyPointsPerRecord;
    }

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Depth parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("depth must be one of brief|medium|deep");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown depth '" + value + "', expected brief|medium|deep");
        }
    }
}
