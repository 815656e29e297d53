package com.researchintel.deepresearch.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Structured outcome of verifying a run's artifacts.
 *
 * For a verdict produced from the report text alone, {@code passed} means no paragraph is missing
 * its terminal citation group. The audit verdict additionally folds in the paragraph log check:
 * {@code passed = reportPassed && paragraphLogPassed && paragraphsWithoutCitation.isEmpty()}.
 */
@Data
@Builder(toBuilder = true)
@Jacksonized
public class VerificationVerdict {

    private int totalParagraphs;
    @Builder.Default
    private List<Integer> paragraphsWithoutCitation = List.of();
    private int citationsFound;
    private int verifiedClaimsCount;
    private int singleSourceClaimsCount;
    private int conflictsCount;     // reserved, conflict detection is not implemented
    private boolean reportPassed;
    private boolean paragraphLogPassed;
    @Builder.Default
    private List<String> paragraphLogErrors = List.of();
    @Builder.Default
    private List<String> issues = List.of();
    private boolean passed;

    @JsonProperty(value = "paragraphWithoutCitationCount", access = JsonProperty.Access.READ_ONLY)
    public int getParagraphWithoutCitationCount() {
        return paragraphsWithoutCitation.size();
    }
}
