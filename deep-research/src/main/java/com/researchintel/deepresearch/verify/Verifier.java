package com.researchintel.deepresearch.verify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.researchintel.deepresearch.citation.CitationRegistry;
import com.researchintel.deepresearch.model.ParagraphLogCheck;
import com.researchintel.deepresearch.model.VerificationVerdict;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks the paragraph citation rule on both run artifacts.
 *
 * Report rule: every paragraph that is not a heading must end, after trailing whitespace is
 * trimmed, with a citation group such as {@code (C001)} or {@code (C001, C004)}. Nothing may
 * follow the closing parenthesis.
 *
 * Paragraph log rule: every line is a {@code {"text", "citeIds"}} record with at least one id,
 * and every id is exactly {@code C} plus three digits.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class Verifier {

    // A blank line, or a newline followed by a non-space character. Indented lines continue a paragraph.
    private static final Pattern PARAGRAPH_BOUNDARY = Pattern.compile("\\n\\s*\\n|\\n(?=\\S)");
    private static final Pattern TERMINAL_CITATION = Pattern.compile("\\((C\\d{3}(?:,\\s*C\\d{3})*)\\)\\z");
    private static final String HEADING_MARKER = "#";

    private final ObjectMapper objectMapper;

    /**
     * Verify the citation rule over a rendered report.
     * {@code paragraphsWithoutCitation} holds 0-based indices into the full paragraph list,
     * headings included; headings themselves are never flagged or counted.
     */
    public VerificationVerdict verifyText(String text) {
        List<String> paragraphs = splitParagraphs(text);

        List<Integer> missing = new ArrayList<>();
        List<String> issues = new ArrayList<>();
        int total = 0;
        int citationsFound = 0;
        int cited = 0;
        int singleSource = 0;

        for (int i = 0; i < paragraphs.size(); i++) {
            String paragraph = paragraphs.get(i);
            if (paragraph.startsWith(HEADING_MARKER)) {
                continue;
            }
            total++;

            Matcher m = TERMINAL_CITATION.matcher(paragraph.stripTrailing());
            if (!m.find()) {
                missing.add(i);
                issues.add("Paragraph " + (i + 1) + " missing citation");
                continue;
            }

            List<String> ids = Arrays.stream(m.group(1).split(",")).map(String::trim).toList();
            citationsFound += ids.size();
            cited++;
            if (new LinkedHashSet<>(ids).size() == 1) {
                singleSource++;
            }
        }

        return VerificationVerdict.builder()
                .totalParagraphs(total)
                .paragraphsWithoutCitation(List.copyOf(missing))
                .citationsFound(citationsFound)
                .verifiedClaimsCount(cited)
                .singleSourceClaimsCount(singleSource)
                .conflictsCount(0)
                .reportPassed(missing.isEmpty())
                .issues(List.copyOf(issues))
                .passed(missing.isEmpty())
                .build();
    }

    /**
     * Check each structured paragraph record independently of the report.
     * Blank lines are ignored; an empty log is itself an error.
     */
    public ParagraphLogCheck verifyParagraphLog(List<String> lines) {
        List<String> errors = new ArrayList<>();
        if (lines == null || lines.stream().allMatch(String::isBlank)) {
            errors.add("paragraph log is empty");
            return new ParagraphLogCheck(false, errors);
        }

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).strip();
            if (line.isEmpty()) continue;
            int lineNo = i + 1;

            JsonNode record;
            try {
                record = objectMapper.readTree(line);
            } catch (JsonProcessingException e) {
                errors.add("Line " + lineNo + ": invalid JSON: " + e.getOriginalMessage());
                continue;
            }
            if (record == null || !record.isObject() || !record.path("text").isTextual()) {
                errors.add("Line " + lineNo + ": not a paragraph record (expected {\"text\", \"citeIds\"})");
                continue;
            }

            JsonNode citeIds = record.path("citeIds");
            if (!citeIds.isArray() || citeIds.isEmpty()) {
                errors.add("Line " + lineNo + ": citeIds is empty");
                continue;
            }
            for (JsonNode cid : citeIds) {
                if (!cid.isTextual()) {
                    errors.add("Line " + lineNo + ": citeId " + cid + " is not a string");
                } else if (!CitationRegistry.isValidId(cid.asText())) {
                    errors.add("Line " + lineNo + ": citeId " + cid.asText() + " invalid format (expected C001-C999)");
                }
            }
        }

        return new ParagraphLogCheck(errors.isEmpty(), List.copyOf(errors));
    }

    /**
     * Combined verdict over the report and the paragraph log. Passes only if the report check,
     * the paragraph log check and the missing-citation count all agree.
     */
    public VerificationVerdict verifyArtifacts(String report, List<String> paragraphLogLines) {
        VerificationVerdict reportVerdict = verifyText(report);
        ParagraphLogCheck logCheck = verifyParagraphLog(paragraphLogLines);

        boolean passed = reportVerdict.isReportPassed()
                && logCheck.passed()
                && reportVerdict.getParagraphsWithoutCitation().isEmpty();

        if (!passed) {
            log.warn("Verification failed: {} paragraph(s) without citation, {} paragraph log error(s)",
                    reportVerdict.getParagraphsWithoutCitation().size(), logCheck.errors().size());
        }

        return reportVerdict.toBuilder()
                .paragraphLogPassed(logCheck.passed())
                .paragraphLogErrors(logCheck.errors())
                .passed(passed)
                .build();
    }

    /**
     * Split into stripped, non-blank paragraphs.
     */
    public List<String> splitParagraphs(String text) {
        if (text == null || text.isBlank()) return List.of();

        String normalized = text.replace("\r\n", "\n").replace('\r', '\n');
        return Arrays.stream(PARAGRAPH_BOUNDARY.split(normalized))
                .map(String::strip)
                .filter(p -> !p.isEmpty())
                .toList();
    }
}
