package com.researchintel.deepresearch.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Locale;

/**
 * Outcome of the clarification gate, persisted as {@code clarify.json} in the run directory.
 */
@Data
@Builder
@Jacksonized
public class ClarificationRecord {

    private Status status;
    private String originalTopic;
    @Builder.Default
    private List<String> questions = List.of();
    @Builder.Default
    private List<String> answers = List.of();
    private String failureReason;   // null unless status is FAILED

    public enum Status {
        PENDING, CLARIFIED, FAILED;

        @JsonValue
        public String id() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
