package com.researchintel.deepresearch.model;

import lombok.Builder;
import lombok.Value;

/**
 * Caller-supplied run parameters. Null fields fall back to the persisted plan record
 * of a resumed run, then to the configured defaults.
 */
@Value
@Builder
public class RunOverrides {

    String runId;
    Integer workers;
    Depth depth;
    Integer budget;
    String lang;
    ClarificationRecord clarification;

    public static RunOverrides none() {
        return RunOverrides.builder().build();
    }
}
