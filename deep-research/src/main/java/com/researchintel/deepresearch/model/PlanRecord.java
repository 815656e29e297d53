package com.researchintel.deepresearch.model;

/**
 * Persisted as {@code logs/plan.json}; the source of run parameters when a run is resumed.
 */
public record PlanRecord(int workers, Depth depth, int budget, String lang, Plan plan) {
}
