package com.researchintel.deepresearch.output;

import com.researchintel.deepresearch.model.VerificationVerdict;
import org.springframework.stereotype.Component;

/**
 * Human-readable verification summary ({@code final/verification.md}).
 */
@Component
public class VerificationSummaryWriter {

    public String render(String runId, VerificationVerdict verdict) {
        StringBuilder md = new StringBuilder()
                .append("# Verification Report\n\n")
                .append("- run_id: ").append(runId).append('\n')
                .append("- paragraph_without_citation_count: ").append(verdict.getParagraphWithoutCitationCount()).append('\n')
                .append("- paragraphs_without_citation: ").append(verdict.getParagraphsWithoutCitation()).append('\n')
                .append("- total_paragraphs: ").append(verdict.getTotalParagraphs()).append('\n')
                .append("- citations_found: ").append(verdict.getCitationsFound()).append('\n')
                .append("- verified_claims_count: ").append(verdict.getVerifiedClaimsCount()).append('\n')
                .append("- single_source_claims_count: ").append(verdict.getSingleSourceClaimsCount()).append('\n')
                .append("- conflicts_count: ").append(verdict.getConflictsCount()).append('\n')
                .append("- paragraph_end_citation_passed: ").append(verdict.isReportPassed()).append('\n')
                .append("- paragraphs_jsonl_cite_ids_passed: ").append(verdict.isParagraphLogPassed()).append('\n')
                .append("- passed: ").append(verdict.isPassed()).append('\n');

        if (!verdict.getIssues().isEmpty() || !verdict.getParagraphLogErrors().isEmpty()) {
            md.append("\n## Issues\n\n");
            verdict.getIssues().forEach(issue -> md.append("- ").append(issue).append('\n'));
            verdict.getParagraphLogErrors().forEach(error -> md.append("- ").append(error).append('\n'));
        }
        return md.toString();
    }
}
