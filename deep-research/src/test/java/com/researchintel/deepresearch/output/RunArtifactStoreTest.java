package com.researchintel.deepresearch.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.researchintel.deepresearch.TestSupport;
import com.researchintel.deepresearch.model.ClarificationRecord;
import com.researchintel.deepresearch.model.Depth;
import com.researchintel.deepresearch.model.Paragraph;
import com.researchintel.deepresearch.model.Plan;
import com.researchintel.deepresearch.model.PlanRecord;
import com.researchintel.deepresearch.model.Stage;
import com.researchintel.deepresearch.model.StageLogEntry;
import com.researchintel.deepresearch.model.StageStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RunArtifactStoreTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = TestSupport.objectMapper();
    private RunArtifactStore store;

    @BeforeEach
    void setUp() {
        store = new RunArtifactStore(TestSupport.properties(tempDir), objectMapper,
                new CitationCsvWriter(), new VerificationSummaryWriter());
    }

    @Test
    void prepareCreatesTheRunLayout() {
        store.prepare("r1");

        assertThat(store.exists("r1")).isTrue();
        for (String sub : List.of("logs", "drafts", "final", "evidence")) {
            assertThat(store.runDir("r1").resolve(sub)).isDirectory();
        }
    }

    @Test
    void stageLogIsAppendOnlyJsonLines() throws Exception {
        Instant now = TestSupport.FIXED_CLOCK.instant();
        store.appendStageLog(new StageLogEntry(now, "r1", Stage.INTAKE, StageStatus.STARTED, Map.of()));
        store.appendStageLog(new StageLogEntry(now, "r1", Stage.INTAKE, StageStatus.COMPLETED,
                Map.of("success", true)));

        List<String> lines = Files.readAllLines(store.stageLogPath("r1"));
        assertThat(lines).hasSize(2);

        JsonNode first = objectMapper.readTree(lines.get(0));
        assertThat(first.get("stage").asText()).isEqualTo("intake");
        assertThat(first.get("status").asText()).isEqualTo("started");
        assertThat(first.get("timestamp").asText()).isEqualTo("2026-03-14T09:26:53Z");

        assertThat(store.readStageLog("r1"))
                .extracting(StageLogEntry::status)
                .containsExactly(StageStatus.STARTED, StageStatus.COMPLETED);
    }

    @Test
    void planRecordRoundTrips() {
        PlanRecord record = new PlanRecord(3, Depth.DEEP, 4, "en",
                new Plan(List.of("q1", "q2"), List.of("web"), 20, Depth.DEEP));

        store.writePlanRecord("r1", record);

        assertThat(store.readPlanRecord("r1")).contains(record);
        assertThat(store.readPlanRecord("missing")).isEmpty();
    }

    @Test
    void clarificationRoundTrips() {
        store.writeClarification("r1", ClarificationRecord.builder()
                .status(ClarificationRecord.Status.PENDING)
                .originalTopic("ml")
                .questions(List.of("Which area?"))
                .build());

        assertThat(store.readClarification("r1")).hasValueSatisfying(record -> {
            assertThat(record.getStatus()).isEqualTo(ClarificationRecord.Status.PENDING);
            assertThat(record.getQuestions()).containsExactly("Which area?");
            assertThat(record.getAnswers()).isEmpty();
        });
    }

    @Test
    void paragraphLogHasOneRecordPerLine() throws Exception {
        store.writeParagraphLog("r1", List.of(
                new Paragraph("First.", List.of("C001")),
                new Paragraph("Second.", List.of("C002", "C003"))));

        List<String> lines = store.readParagraphLog("r1").orElseThrow();
        assertThat(lines).hasSize(2);
        assertThat(objectMapper.readTree(lines.get(1)).get("citeIds").size()).isEqualTo(2);
        assertThat(store.readParagraphLog("missing")).isEmpty();
    }
}
