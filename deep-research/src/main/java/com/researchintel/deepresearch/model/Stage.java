package com.researchintel.deepresearch.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * Pipeline stages. Declaration order is execution order.
 */
public enum Stage {
    INTAKE,
    PLAN,
    HARVEST,
    FETCH,
    EXTRACT,
    VERIFY,
    WRITE,
    AUDIT,
    CACHE;

    private static final List<Stage> PIPELINE = List.of(values());

    public static List<Stage> pipeline() {
        return PIPELINE;
    }

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
