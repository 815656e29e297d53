package com.researchintel.deepresearch.model;

import java.time.Instant;
import java.util.Map;

/**
 * One line of the append-only {@code logs/pipeline.jsonl} stage log.
 */
public record StageLogEntry(Instant timestamp,
                            String runId,
                            Stage stage,
                            StageStatus status,
                            Map<String, Object> details) {
}
