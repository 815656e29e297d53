package com.researchintel.deepresearch.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.researchintel.deepresearch.config.DeepResearchProperties;
import com.researchintel.deepresearch.model.Citation;
import com.researchintel.deepresearch.model.ClarificationRecord;
import com.researchintel.deepresearch.model.Paragraph;
import com.researchintel.deepresearch.model.PlanRecord;
import com.researchintel.deepresearch.model.StageLogEntry;
import com.researchintel.deepresearch.model.VerificationVerdict;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads and writes the artifacts of a run directory.
 *
 * Layout under {runsDir}/{runId}:
 *   logs/pipeline.jsonl       append-only stage transitions
 *   logs/plan.json            run parameters and plan
 *   clarify.json              clarification record
 *   drafts/paragraphs.jsonl   structured paragraph log
 *   final/report.md           rendered report
 *   final/verification.md     verification summary
 *   evidence/citations.json   citation registry snapshot (plus citations.csv)
 *   evidence/verify.json      verification snapshot
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RunArtifactStore {

    private final DeepResearchProperties properties;
    private final ObjectMapper objectMapper;
    private final CitationCsvWriter citationCsvWriter;
    private final VerificationSummaryWriter summaryWriter;

    public Path runDir(String runId) {
        return Paths.get(properties.getRunsDir()).resolve(runId);
    }

    public boolean exists(String runId) {
        return Files.isDirectory(runDir(runId));
    }

    public void prepare(String runId) {
        Path dir = runDir(runId);
        for (String sub : List.of("logs", "drafts", "final", "evidence")) {
            ensureDirectory(dir.resolve(sub));
        }
        log.debug("Run directory ready: {}", dir);
    }

    // ── Stage log ────────────────────────────────────────────────────────────

    public void appendStageLog(StageLogEntry entry) {
        Path file = stageLogPath(entry.runId());
        ensureDirectory(file.getParent());
        try {
            Files.writeString(file, objectMapper.writeValueAsString(entry) + "\n", StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot append stage log " + file, e);
        }
    }

    public List<StageLogEntry> readStageLog(String runId) {
        List<StageLogEntry> entries = new ArrayList<>();
        for (String line : readLines(stageLogPath(runId)).orElse(List.of())) {
            if (line.isBlank()) continue;
            entries.add(readJson(line, StageLogEntry.class));
        }
        return entries;
    }

    public Path stageLogPath(String runId) {
        return runDir(runId).resolve("logs").resolve("pipeline.jsonl");
    }

    // ── Plan and clarification ───────────────────────────────────────────────

    public void writePlanRecord(String runId, PlanRecord record) {
        writeJson(runDir(runId).resolve("logs").resolve("plan.json"), record);
    }

    public Optional<PlanRecord> readPlanRecord(String runId) {
        return readJsonFile(runDir(runId).resolve("logs").resolve("plan.json"), PlanRecord.class);
    }

    public void writeClarification(String runId, ClarificationRecord record) {
        ensureDirectory(runDir(runId));
        writeJson(runDir(runId).resolve("clarify.json"), record);
    }

    public Optional<ClarificationRecord> readClarification(String runId) {
        return readJsonFile(runDir(runId).resolve("clarify.json"), ClarificationRecord.class);
    }

    // ── Drafts, report, evidence ─────────────────────────────────────────────

    public void writeParagraphLog(String runId, List<Paragraph> paragraphs) {
        StringBuilder lines = new StringBuilder();
        for (Paragraph paragraph : paragraphs) {
            lines.append(toJson(paragraph)).append('\n');
        }
        writeString(paragraphLogPath(runId), lines.toString());
    }

    public Optional<List<String>> readParagraphLog(String runId) {
        return readLines(paragraphLogPath(runId));
    }

    public Path paragraphLogPath(String runId) {
        return runDir(runId).resolve("drafts").resolve("paragraphs.jsonl");
    }

    public void writeReport(String runId, String report) {
        writeString(reportPath(runId), report);
    }

    public Optional<String> readReport(String runId) {
        Path path = reportPath(runId);
        if (!Files.exists(path)) return Optional.empty();
        try {
            return Optional.of(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read report " + path, e);
        }
    }

    public Path reportPath(String runId) {
        return runDir(runId).resolve("final").resolve("report.md");
    }

    public void writeCitations(String runId, List<Citation> citations) {
        Path evidence = runDir(runId).resolve("evidence");
        writeJson(evidence.resolve("citations.json"), citations);
        citationCsvWriter.write(evidence.resolve("citations.csv"), citations);
    }

    public List<Citation> readCitations(String runId) {
        Path path = runDir(runId).resolve("evidence").resolve("citations.json");
        return readJsonFile(path, Citation[].class).map(List::of).orElse(List.of());
    }

    public void writeVerificationSnapshot(String runId, Map<String, Object> snapshot) {
        writeJson(verifySnapshotPath(runId), snapshot);
    }

    public void writeVerdict(String runId, VerificationVerdict verdict) {
        writeJson(verifySnapshotPath(runId), verdict);
        writeString(runDir(runId).resolve("final").resolve("verification.md"), summaryWriter.render(runId, verdict));
    }

    public Path verifySnapshotPath(String runId) {
        return runDir(runId).resolve("evidence").resolve("verify.json");
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void writeJson(Path path, Object value) {
        ensureDirectory(path.getParent());
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), value);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write " + path, e);
        }
    }

    private <T> Optional<T> readJsonFile(Path path, Class<T> type) {
        if (!Files.exists(path)) return Optional.empty();
        try {
            return Optional.ofNullable(objectMapper.readValue(path.toFile(), type));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + path, e);
        }
    }

    private <T> T readJson(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Malformed record: " + json, e);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + value, e);
        }
    }

    private void writeString(Path path, String content) {
        ensureDirectory(path.getParent());
        try {
            Files.writeString(path, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write " + path, e);
        }
    }

    private Optional<List<String>> readLines(Path path) {
        if (!Files.exists(path)) return Optional.empty();
        try {
            return Optional.of(Files.readAllLines(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + path, e);
        }
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create directory: " + dir, e);
        }
    }
}
